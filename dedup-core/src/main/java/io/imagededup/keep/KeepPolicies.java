package io.imagededup.keep;

import io.imagededup.ActionDecision;
import io.imagededup.config.DedupConfig;
import io.imagededup.fs.FileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Built-in keep policies.
 */
public final class KeepPolicies {

    private static final Logger log = LoggerFactory.getLogger(KeepPolicies.class);

    /** Stand-in modification time for paths that cannot be stat'ed */
    static final Instant UNKNOWN_TIME = Instant.EPOCH;

    private KeepPolicies() {
    }

    /**
     * Resolves a configuration selector.
     *
     * @param name "keepOldest" or "keepShortestPath"
     */
    public static KeepPolicy forName(String name, FileSystem fileSystem) {
        return switch (name) {
            case DedupConfig.KEEP_OLDEST -> oldestFile(fileSystem);
            case DedupConfig.KEEP_SHORTEST_PATH -> shortestPath();
            default -> throw new IllegalArgumentException("Unknown keep strategy: " + name +
                ". Use: " + DedupConfig.KEEP_OLDEST + ", " + DedupConfig.KEEP_SHORTEST_PATH);
        };
    }

    /**
     * Keeps the file with the earliest modification time; ties keep the first one seen.
     *
     * <p>A path whose modification time cannot be read is treated as modified at
     * {@link Instant#EPOCH}, so it usually wins.</p>
     */
    public static KeepPolicy oldestFile(FileSystem fileSystem) {
        Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        return paths -> {
            if (paths.isEmpty()) {
                return ActionDecision.empty();
            }

            Path keep = paths.get(0);
            Instant oldest = modifiedTime(fileSystem, keep);
            List<Path> remove = new ArrayList<>(paths.size() - 1);

            for (Path path : paths.subList(1, paths.size())) {
                Instant time = modifiedTime(fileSystem, path);
                if (time.isBefore(oldest)) {
                    remove.add(keep);
                    keep = path;
                    oldest = time;
                } else {
                    remove.add(path);
                }
            }
            return new ActionDecision(keep, remove);
        };
    }

    /**
     * Keeps the path with the fewest characters; ties keep the first one seen.
     */
    public static KeepPolicy shortestPath() {
        return paths -> {
            if (paths.isEmpty()) {
                return ActionDecision.empty();
            }

            Path keep = paths.get(0);
            List<Path> remove = new ArrayList<>(paths.size() - 1);

            for (Path path : paths.subList(1, paths.size())) {
                if (path.toString().length() < keep.toString().length()) {
                    remove.add(keep);
                    keep = path;
                } else {
                    remove.add(path);
                }
            }
            return new ActionDecision(keep, remove);
        };
    }

    private static Instant modifiedTime(FileSystem fileSystem, Path path) {
        try {
            return fileSystem.stat(path).modifiedTime();
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}, using {}: {}", path, UNKNOWN_TIME, e.getMessage());
            return UNKNOWN_TIME;
        }
    }
}
