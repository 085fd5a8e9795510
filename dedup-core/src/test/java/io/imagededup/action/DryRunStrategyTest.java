package io.imagededup.action;

import io.imagededup.i18n.BundleLocalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DryRunStrategyTest {

    @Test
    void testExecuteLeavesFilesAlone(@TempDir Path dir) throws IOException {
        Path keep = Files.write(dir.resolve("a.jpg"), new byte[]{1, 2, 3});
        Path remove = Files.write(dir.resolve("b.jpg"), new byte[]{1, 2, 3});
        Map<Path, String> before = snapshot(dir);
        DryRunStrategy strategy = new DryRunStrategy(BundleLocalizer.forLanguage("en"));

        strategy.execute(ImageFile.of(keep), ImageFile.of(remove));

        assertEquals(before, snapshot(dir));
        assertEquals(2, before.size());
    }

    @Test
    void testHasNoResources() {
        assertNull(new DryRunStrategy(BundleLocalizer.forLanguage("en")).getResources());
    }

    @Test
    void testRejectsMissingArguments() {
        DryRunStrategy strategy = new DryRunStrategy(BundleLocalizer.forLanguage("en"));
        ImageFile file = ImageFile.of(Path.of("/photos/a.jpg"));

        assertThrows(IllegalArgumentException.class, () -> strategy.execute(null, file));
        assertThrows(IllegalArgumentException.class, () -> strategy.execute(file, null));
    }

    private static Map<Path, String> snapshot(Path dir) throws IOException {
        Map<Path, String> listing = new TreeMap<>();
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                listing.put(dir.relativize(file),
                    Files.size(file) + "@" + Files.getLastModifiedTime(file).toMillis());
            }
        }
        return listing;
    }
}
