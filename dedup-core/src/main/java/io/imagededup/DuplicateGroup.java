package io.imagededup;

import java.nio.file.Path;
import java.util.List;

/**
 * A group of images judged visually identical.
 */
public record DuplicateGroup(
    /** Member paths in clustering order; the first one is the group's base */
    List<Path> paths
) {
    public DuplicateGroup {
        if (paths == null || paths.size() < 2) {
            throw new IllegalArgumentException("duplicate group needs at least 2 paths");
        }
        paths = List.copyOf(paths);
    }

    public int size() {
        return paths.size();
    }
}
