package io.imagededup.fs;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a filesystem entry.
 */
public record FileStat(
    /** Last modification time */
    Instant modifiedTime,

    /** Size in bytes */
    long size,

    /** Whether the entry is a regular file */
    boolean regularFile
) {
    public FileStat {
        Objects.requireNonNull(modifiedTime, "modifiedTime cannot be null");
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
    }

    /**
     * Creates a stat for a regular file.
     */
    public static FileStat ofFile(long size, Instant modifiedTime) {
        return new FileStat(modifiedTime, size, true);
    }
}
