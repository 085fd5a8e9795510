package io.imagededup.action;

import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Logs what would be moved without touching the filesystem.
 */
public class DryRunStrategy implements ResolutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(DryRunStrategy.class);

    private final Localizer localizer;

    public DryRunStrategy(Localizer localizer) {
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
    }

    @Override
    public void execute(ImageFile keep, ImageFile remove) {
        if (keep == null || remove == null) {
            throw new IllegalArgumentException("keep and remove images cannot be null");
        }
        log.info(localizer.translate("DryRunWouldMoveFile",
            Map.of("Source", remove.path(), "Destination", keep.path())));
    }

    @Override
    public ActionResource getResources() {
        return null;
    }
}
