package io.imagededup.fs;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link FileSystem} for tests.
 *
 * <p>Files are kept in insertion order so walks are deterministic. Individual
 * operations can be made to fail per path.</p>
 */
public class FakeFileSystem implements FileSystem {

    private final Map<Path, Entry> files = new LinkedHashMap<>();
    private final Set<Path> directories = new HashSet<>();
    private final Map<Path, IOException> walkFailures = new LinkedHashMap<>();
    private final Set<Path> failingStats = new HashSet<>();
    private final Set<Path> failingRenames = new HashSet<>();
    private final Map<Path, Path> renames = new HashMap<>();
    private final List<Path> createdDirectories = new ArrayList<>();
    private IOException createDirectoriesFailure;

    // ==================== Setup ====================

    public FakeFileSystem addDirectory(Path dir) {
        directories.add(dir);
        return this;
    }

    public FakeFileSystem addFile(Path path, long size) {
        return addFile(path, size, Instant.parse("2020-01-01T00:00:00Z"));
    }

    public FakeFileSystem addFile(Path path, long size, Instant modified) {
        files.put(path, new Entry(new byte[0], FileStat.ofFile(size, modified)));
        return this;
    }

    public FakeFileSystem addFile(Path path, byte[] content, Instant modified) {
        files.put(path, new Entry(content, FileStat.ofFile(content.length, modified)));
        return this;
    }

    public FakeFileSystem failWalkEntry(Path path, IOException error) {
        walkFailures.put(path, error);
        return this;
    }

    public FakeFileSystem failStat(Path path) {
        failingStats.add(path);
        return this;
    }

    public FakeFileSystem failRename(Path path) {
        failingRenames.add(path);
        return this;
    }

    public FakeFileSystem failCreateDirectories(IOException error) {
        this.createDirectoriesFailure = error;
        return this;
    }

    // ==================== Inspection ====================

    public boolean exists(Path path) {
        return files.containsKey(path);
    }

    public Map<Path, Path> getRenames() {
        return renames;
    }

    public List<Path> getCreatedDirectories() {
        return createdDirectories;
    }

    // ==================== FileSystem ====================

    @Override
    public InputStream open(Path path) throws IOException {
        Entry entry = files.get(path);
        if (entry == null) {
            throw new NoSuchFileException(path.toString());
        }
        return new ByteArrayInputStream(entry.content());
    }

    @Override
    public FileStat stat(Path path) throws IOException {
        Entry entry = files.get(path);
        if (entry == null || failingStats.contains(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return entry.stat();
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        if (failingRenames.contains(source) || !files.containsKey(source)) {
            throw new IOException("rename failed: " + source);
        }
        files.put(target, files.remove(source));
        renames.put(source, target);
    }

    @Override
    public void createDirectories(Path dir) throws IOException {
        if (createDirectoriesFailure != null) {
            throw createDirectoriesFailure;
        }
        directories.add(dir);
        createdDirectories.add(dir);
    }

    @Override
    public void walk(Path root, WalkVisitor visitor) throws IOException {
        if (!directories.contains(root)) {
            throw new NoSuchFileException(root.toString());
        }
        for (Map.Entry<Path, Entry> e : new ArrayList<>(files.entrySet())) {
            if (e.getKey().startsWith(root)) {
                visitor.visitFile(e.getKey(), e.getValue().stat());
            }
        }
        for (Map.Entry<Path, IOException> e : walkFailures.entrySet()) {
            if (e.getKey().startsWith(root)) {
                visitor.visitFailed(e.getKey(), e.getValue());
            }
        }
    }

    private record Entry(byte[] content, FileStat stat) {}
}
