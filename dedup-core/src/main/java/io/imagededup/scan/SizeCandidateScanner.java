package io.imagededup.scan;

import io.imagededup.CandidateScanner;
import io.imagededup.FileGroup;
import io.imagededup.fs.FileStat;
import io.imagededup.fs.FileSystem;
import io.imagededup.fs.WalkVisitor;
import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link CandidateScanner} that groups image files by exact byte size.
 *
 * <p>Files of different sizes are never compared, so a file whose size is
 * unique in the tree is dropped before hashing. This also means a re-encoded or
 * resized copy of an image is never considered a candidate.</p>
 */
public class SizeCandidateScanner implements CandidateScanner {

    private static final Logger log = LoggerFactory.getLogger(SizeCandidateScanner.class);

    private final Set<String> allowedExtensions;
    private final FileSystem fileSystem;
    private final Localizer localizer;

    /**
     * @param allowedExtensions Extensions with leading dot, compared case-insensitively
     */
    public SizeCandidateScanner(Collection<String> allowedExtensions, FileSystem fileSystem, Localizer localizer) {
        Objects.requireNonNull(allowedExtensions, "allowedExtensions cannot be null");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
        this.allowedExtensions = Set.copyOf(allowedExtensions.stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .toList());
    }

    @Override
    public FileGroup scan(Path root) throws IOException {
        log.info(localizer.translate("ScanningForFiles", Map.of("Root", root)));

        Map<Long, List<Path>> bySize = new HashMap<>();
        try {
            fileSystem.walk(root, new WalkVisitor() {
                @Override
                public void visitFile(Path path, FileStat stat) {
                    if (stat.size() < 1 || !isAllowed(path)) {
                        return;
                    }
                    bySize.computeIfAbsent(stat.size(), size -> new ArrayList<>())
                        .add(path.toAbsolutePath());
                }

                @Override
                public void visitFailed(Path path, IOException error) {
                    log.warn(localizer.translate("ErrorAccessingPath",
                        Map.of("FilePath", path, "Error", String.valueOf(error.getMessage()))));
                }
            });
        } catch (IOException e) {
            throw new IOException("Failed to walk directory " + root + ": " + e.getMessage(), e);
        }

        List<List<Path>> buckets = new ArrayList<>();
        for (List<Path> paths : bySize.values()) {
            if (paths.size() >= 2) {
                buckets.add(paths);
            }
        }
        FileGroup group = new FileGroup(buckets);

        log.info(localizer.translate("PotentialDuplicateGroupsFound",
            Map.of("Count", group.bucketCount(), "Files", group.fileCount())));
        return group;
    }

    boolean isAllowed(Path path) {
        return allowedExtensions.contains(extensionOf(path));
    }

    /**
     * Lower-cased extension including the dot, or "" when there is none.
     */
    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
