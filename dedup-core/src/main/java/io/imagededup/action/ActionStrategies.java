package io.imagededup.action;

import io.imagededup.config.DedupConfig;
import io.imagededup.fs.FileSystem;
import io.imagededup.i18n.Localizer;

/**
 * Builds the strategy named by a configuration selector.
 */
public final class ActionStrategies {

    private ActionStrategies() {
    }

    /**
     * @throws IllegalArgumentException for an unknown {@code actionStrategy}
     */
    public static ResolutionStrategy create(DedupConfig config, FileSystem fileSystem, Localizer localizer) {
        String name = config.actionStrategy();
        if (name == null) {
            throw new IllegalArgumentException("action strategy is required");
        }
        return switch (name) {
            case DedupConfig.ACTION_DRY_RUN -> new DryRunStrategy(localizer);
            case DedupConfig.ACTION_MOVE_TO_TRASH ->
                new MoveToTrashStrategy(config.effectiveTrashPath(), fileSystem, localizer);
            default -> throw new IllegalArgumentException("Unknown action strategy: " + name +
                ". Use: " + DedupConfig.ACTION_DRY_RUN + ", " + DedupConfig.ACTION_MOVE_TO_TRASH);
        };
    }
}
