package io.imagededup.action;

import io.imagededup.fs.FileSystem;
import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves each duplicate into a trash directory.
 *
 * <p>The moved file is renamed to {@code <nanos>_<original name>}. The
 * nanosecond stamp is strictly increasing per strategy instance, so two
 * duplicates with the same name never collide within a run.</p>
 */
public class MoveToTrashStrategy implements ResolutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(MoveToTrashStrategy.class);

    private final TrashDirectoryResource trashResource;
    private final FileSystem fileSystem;
    private final Localizer localizer;
    private final Clock clock;
    private final AtomicLong lastStamp = new AtomicLong(Long.MIN_VALUE);

    public MoveToTrashStrategy(Path trashDir, FileSystem fileSystem, Localizer localizer) {
        this(trashDir, fileSystem, localizer, Clock.systemUTC());
    }

    public MoveToTrashStrategy(Path trashDir, FileSystem fileSystem, Localizer localizer, Clock clock) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.trashResource = new TrashDirectoryResource(trashDir, fileSystem, localizer);
    }

    @Override
    public void execute(ImageFile keep, ImageFile remove) throws IOException {
        if (remove == null) {
            throw new IllegalArgumentException("remove image cannot be null");
        }

        Path source = remove.path();
        Path target = trashResource.getTrashDir().resolve(nextStamp() + "_" + remove.originalFileName());

        log.info(localizer.translate("MovingFile", Map.of("From", source, "To", target)));
        try {
            fileSystem.rename(source, target);
        } catch (IOException e) {
            log.error(localizer.translate("MovingFileError",
                Map.of("FilePath", source, "Error", String.valueOf(e.getMessage()))));
            throw e;
        }
    }

    @Override
    public ActionResource getResources() {
        return trashResource;
    }

    private long nextStamp() {
        Instant now = clock.instant();
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        return lastStamp.updateAndGet(previous -> Math.max(previous + 1, nanos));
    }
}
