package io.imagededup.i18n;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link Localizer} backed by the {@code messages} resource bundle.
 *
 * <p>Placeholders use the {@code {Name}} form; unknown placeholders are left
 * untouched.</p>
 */
public class BundleLocalizer implements Localizer {

    private static final Logger log = LoggerFactory.getLogger(BundleLocalizer.class);

    private static final String BUNDLE_NAME = "io.imagededup.i18n.messages";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final ResourceBundle bundle;
    private final Locale locale;

    public BundleLocalizer(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale cannot be null");
        this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, locale,
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        log.debug("Loaded message bundle for locale {} (resolved {})", locale, bundle.getLocale());
    }

    /**
     * Creates a localizer for a language tag such as {@code "en"} or {@code "de"}.
     */
    public static BundleLocalizer forLanguage(String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            return new BundleLocalizer(Locale.ENGLISH);
        }
        return new BundleLocalizer(Locale.forLanguageTag(languageTag));
    }

    @Override
    public String translate(String key, Map<String, ?> params) {
        String template;
        try {
            template = bundle.getString(key);
        } catch (MissingResourceException e) {
            log.debug("No message for key '{}' in locale {}", key, locale);
            return key;
        }

        if (params == null || params.isEmpty()) {
            return template;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                ? String.valueOf(params.get(name))
                : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public Locale getLocale() {
        return locale;
    }
}
