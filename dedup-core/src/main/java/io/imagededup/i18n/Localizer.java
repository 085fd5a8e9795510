package io.imagededup.i18n;

import java.util.Map;

/**
 * Turns a message id and its parameters into a human readable string.
 *
 * <p>Output is cosmetic: callers never branch on it.</p>
 */
public interface Localizer {

    /**
     * Translates a message with named parameters.
     *
     * @param key Message id
     * @param params Values for {@code {Name}} placeholders
     * @return The translated text, or {@code key} if the message is unknown
     */
    String translate(String key, Map<String, ?> params);

    /**
     * Translates a message without parameters.
     */
    default String translate(String key) {
        return translate(key, Map.of());
    }
}
