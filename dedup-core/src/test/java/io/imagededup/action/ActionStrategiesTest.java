package io.imagededup.action;

import io.imagededup.config.DedupConfig;
import io.imagededup.fs.FakeFileSystem;
import io.imagededup.i18n.BundleLocalizer;
import io.imagededup.i18n.Localizer;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ActionStrategiesTest {

    private final FakeFileSystem fs = new FakeFileSystem();
    private final Localizer localizer = BundleLocalizer.forLanguage("en");

    @Test
    void testDryRun() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"));

        assertInstanceOf(DryRunStrategy.class, ActionStrategies.create(config, fs, localizer));
    }

    @Test
    void testMoveToTrashUsesDefaultTrashDirectory() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"))
            .withActionStrategy(DedupConfig.ACTION_MOVE_TO_TRASH);

        ResolutionStrategy strategy = ActionStrategies.create(config, fs, localizer);

        TrashDirectoryResource resource = (TrashDirectoryResource) strategy.getResources();
        assertEquals(Path.of("/photos/.trash"), resource.getTrashDir());
    }

    @Test
    void testMoveToTrashUsesConfiguredDirectory() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"))
            .withActionStrategy(DedupConfig.ACTION_MOVE_TO_TRASH)
            .withTrashPath(Path.of("/bin"));

        TrashDirectoryResource resource =
            (TrashDirectoryResource) ActionStrategies.create(config, fs, localizer).getResources();

        assertEquals(Path.of("/bin"), resource.getTrashDir());
    }

    @Test
    void testUnknownStrategy() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos")).withActionStrategy("delete");

        assertThrows(IllegalArgumentException.class, () -> ActionStrategies.create(config, fs, localizer));
    }
}
