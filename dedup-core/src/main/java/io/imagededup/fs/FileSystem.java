package io.imagededup.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * The file operations the dedup pipeline needs.
 *
 * <p>Everything that touches the disk goes through this interface so tests can
 * substitute an in-memory or failing implementation.</p>
 */
public interface FileSystem {

    /**
     * Returns the local, {@code java.nio.file} backed implementation.
     */
    static FileSystem local() {
        return LocalFileSystem.INSTANCE;
    }

    /**
     * Opens a file for reading. The caller closes the stream.
     */
    InputStream open(Path path) throws IOException;

    /**
     * Reads size and modification time of a path.
     */
    FileStat stat(Path path) throws IOException;

    /**
     * Moves {@code source} to {@code target}.
     */
    void rename(Path source, Path target) throws IOException;

    /**
     * Creates a directory and any missing parents. Succeeds if it already exists.
     */
    void createDirectories(Path dir) throws IOException;

    /**
     * Walks the tree below {@code root}, reporting regular files and unreadable
     * entries to the visitor.
     *
     * @throws IOException if the root itself cannot be walked
     */
    void walk(Path root, WalkVisitor visitor) throws IOException;
}
