package io.imagededup;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Finds files that could be duplicates of each other.
 */
public interface CandidateScanner {

    /**
     * Walks {@code root} and groups eligible files by size.
     *
     * @param root Directory to scan
     * @return Buckets of at least two same-sized files, in no particular order
     * @throws IOException if {@code root} itself cannot be walked
     */
    FileGroup scan(Path root) throws IOException;
}
