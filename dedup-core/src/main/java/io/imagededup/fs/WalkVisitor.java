package io.imagededup.fs;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Callback for {@link FileSystem#walk(Path, WalkVisitor)}.
 */
public interface WalkVisitor {

    /**
     * Called once per regular file below the walk root.
     */
    void visitFile(Path path, FileStat stat);

    /**
     * Called for an entry that could not be read, or a directory that could not be fully listed.
     * The walk continues after this call.
     */
    void visitFailed(Path path, IOException error);
}
