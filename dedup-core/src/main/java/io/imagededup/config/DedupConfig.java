package io.imagededup.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Settings for one deduplication run.
 */
public record DedupConfig(
    /** Root directory to scan */
    Path source,

    /** Lower-cased file extensions (with leading dot) eligible for hashing */
    List<String> allowedExtensions,

    /** Maximum fingerprint distance for two images to count as duplicates */
    int threshold,

    /** Hashing worker count (0 or less = number of processors) */
    int workers,

    /** Directory receiving removed files; blank = {@code <source>/.trash} */
    Path trashPath,

    /** Keep policy selector, e.g. "keepOldest" */
    String keepStrategy,

    /** Action strategy selector, e.g. "dryRun" */
    String actionStrategy,

    /** Fingerprint algorithm selector, "difference" or "average" */
    String hashAlgorithm,

    /** Language tag for log messages */
    String locale
) {

    public static final String ACTION_DRY_RUN = "dryRun";
    public static final String ACTION_MOVE_TO_TRASH = "moveToTrash";

    public static final String KEEP_OLDEST = "keepOldest";
    public static final String KEEP_SHORTEST_PATH = "keepShortestPath";

    public static final String HASH_DIFFERENCE = "difference";
    public static final String HASH_AVERAGE = "average";

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif");

    public DedupConfig {
        allowedExtensions = allowedExtensions != null
            ? allowedExtensions.stream().map(DedupConfig::normalizeExtension).toList()
            : DEFAULT_EXTENSIONS;
    }

    public static DedupConfig defaults() {
        return new DedupConfig(
            null,
            DEFAULT_EXTENSIONS,
            1,
            Runtime.getRuntime().availableProcessors(),
            null,
            KEEP_OLDEST,
            ACTION_DRY_RUN,
            HASH_DIFFERENCE,
            Locale.ENGLISH.getLanguage()
        );
    }

    public static DedupConfig forSource(Path source) {
        return defaults().withSource(source);
    }

    /**
     * Worker count with the processor default applied.
     */
    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Trash directory with the {@code <source>/.trash} default applied.
     */
    public Path effectiveTrashPath() {
        if (trashPath != null && !trashPath.toString().isBlank()) {
            return trashPath;
        }
        return source.resolve(".trash");
    }

    /**
     * Checks every field and returns this config.
     *
     * @throws IllegalArgumentException describing the first invalid value
     */
    public DedupConfig validate() {
        if (source == null || source.toString().isBlank()) {
            throw new IllegalArgumentException("source directory is required");
        }
        if (allowedExtensions.isEmpty()) {
            throw new IllegalArgumentException("at least one allowed extension is required");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative, got " + threshold);
        }
        requireOneOf("keepStrategy", keepStrategy, KEEP_OLDEST, KEEP_SHORTEST_PATH);
        requireOneOf("actionStrategy", actionStrategy, ACTION_DRY_RUN, ACTION_MOVE_TO_TRASH);
        requireOneOf("hashAlgorithm", hashAlgorithm, HASH_DIFFERENCE, HASH_AVERAGE);
        return this;
    }

    public DedupConfig withSource(Path source) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withAllowedExtensions(List<String> allowedExtensions) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withThreshold(int threshold) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withWorkers(int workers) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withTrashPath(Path trashPath) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withKeepStrategy(String keepStrategy) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withActionStrategy(String actionStrategy) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withHashAlgorithm(String hashAlgorithm) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    public DedupConfig withLocale(String locale) {
        return new DedupConfig(source, allowedExtensions, threshold, workers, trashPath, keepStrategy, actionStrategy, hashAlgorithm, locale);
    }

    private static String normalizeExtension(String ext) {
        String trimmed = ext.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    private static void requireOneOf(String field, String value, String... allowed) {
        for (String candidate : allowed) {
            if (candidate.equals(value)) {
                return;
            }
        }
        throw new IllegalArgumentException(String.format(
            "Unknown %s '%s'. Use: %s", field, value, String.join(", ", allowed)));
    }
}
