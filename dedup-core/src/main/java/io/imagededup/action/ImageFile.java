package io.imagededup.action;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An image file handed to a {@link ResolutionStrategy}.
 */
public record ImageFile(
    /** Absolute path of the file */
    Path path,

    /** File name at scan time */
    String originalFileName
) {
    public ImageFile {
        Objects.requireNonNull(path, "path cannot be null");
        if (originalFileName == null) {
            Path name = path.getFileName();
            originalFileName = name != null ? name.toString() : path.toString();
        }
    }

    public static ImageFile of(Path path) {
        return new ImageFile(path, null);
    }
}
