package io.imagededup.action;

import io.imagededup.fs.FileSystem;
import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Makes sure the trash directory exists before files are moved into it.
 */
public class TrashDirectoryResource implements ActionResource {

    private static final Logger log = LoggerFactory.getLogger(TrashDirectoryResource.class);

    private final Path trashDir;
    private final FileSystem fileSystem;
    private final Localizer localizer;

    public TrashDirectoryResource(Path trashDir, FileSystem fileSystem, Localizer localizer) {
        this.trashDir = Objects.requireNonNull(trashDir, "trashDir cannot be null");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
    }

    @Override
    public void setup() throws IOException {
        log.info(localizer.translate("MoveToTrashSetup", Map.of("Dir", trashDir)));
        fileSystem.createDirectories(trashDir);
    }

    @Override
    public void teardown() {
        log.debug("Trash directory {} released", trashDir);
    }

    public Path getTrashDir() {
        return trashDir;
    }
}
