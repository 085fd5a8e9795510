package io.imagededup.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * {@link FileSystem} backed by {@code java.nio.file}.
 */
public final class LocalFileSystem implements FileSystem {

    static final LocalFileSystem INSTANCE = new LocalFileSystem();

    private LocalFileSystem() {
    }

    @Override
    public InputStream open(Path path) throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public FileStat stat(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return toStat(attrs);
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        Files.move(source, target);
    }

    @Override
    public void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public void walk(Path root, WalkVisitor visitor) throws IOException {
        // Fails fast when the root is missing or unreadable
        BasicFileAttributes rootAttrs = Files.readAttributes(root, BasicFileAttributes.class);
        if (!rootAttrs.isDirectory()) {
            throw new IOException("Not a directory: " + root);
        }

        Files.walkFileTree(root, new TreeVisitor(visitor));
    }

    /**
     * Reports regular files and unreadable entries to a {@link WalkVisitor}.
     *
     * <p>Symbolic links are not followed and not reported: a link and its
     * target would always look like a duplicate pair.</p>
     */
    static final class TreeVisitor extends SimpleFileVisitor<Path> {

        private final WalkVisitor visitor;

        TreeVisitor(WalkVisitor visitor) {
            this.visitor = visitor;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                visitor.visitFile(file, toStat(attrs));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            visitor.visitFailed(file, exc);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            // iteration stopped early; siblings of this directory are still walked
            if (exc != null) {
                visitor.visitFailed(dir, exc);
            }
            return FileVisitResult.CONTINUE;
        }
    }

    private static FileStat toStat(BasicFileAttributes attrs) {
        return new FileStat(attrs.lastModifiedTime().toInstant(), attrs.size(), attrs.isRegularFile());
    }
}
