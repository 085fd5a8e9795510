package io.imagededup;

import java.util.List;

/**
 * Clusters hashed files into groups of visual duplicates.
 */
public interface DuplicateGrouper {

    /**
     * Groups records whose fingerprints are close enough.
     *
     * @return Groups of two or more paths; a path appears in at most one group
     */
    List<DuplicateGroup> group(List<HashRecord> records);
}
