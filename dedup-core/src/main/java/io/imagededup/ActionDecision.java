package io.imagededup;

import java.nio.file.Path;
import java.util.List;

/**
 * Which member of a duplicate group to keep and which ones to remove.
 */
public record ActionDecision(
    /** The file to retain, null only for the empty decision */
    Path keep,

    /** Every other group member, each exactly once */
    List<Path> remove
) {
    private static final ActionDecision EMPTY = new ActionDecision(null, List.of());

    public ActionDecision {
        remove = remove != null ? List.copyOf(remove) : List.of();
        if (keep == null && !remove.isEmpty()) {
            throw new IllegalArgumentException("remove must be empty when nothing is kept");
        }
        if (keep != null && remove.contains(keep)) {
            throw new IllegalArgumentException("keep path must not be in remove list: " + keep);
        }
    }

    /**
     * The decision for an empty group.
     */
    public static ActionDecision empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return keep == null;
    }
}
