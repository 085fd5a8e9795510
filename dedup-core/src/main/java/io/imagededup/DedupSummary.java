package io.imagededup;

/**
 * Outcome of a {@link DedupTask} run.
 */
public record DedupSummary(
    /** Files that survived the size pre-filter */
    int candidates,

    /** Candidates that were hashed successfully */
    int hashed,

    /** Duplicate groups found */
    int groups,

    /** Files decided for removal across all groups */
    int filesToRemove,

    /** Strategy executions that failed */
    int failedActions
) {
    public static DedupSummary empty() {
        return new DedupSummary(0, 0, 0, 0, 0);
    }

    public boolean hasDuplicates() {
        return groups > 0;
    }
}
