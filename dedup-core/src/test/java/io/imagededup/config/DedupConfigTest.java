package io.imagededup.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DedupConfigTest {

    @Test
    void testDefaults() {
        DedupConfig config = DedupConfig.defaults();

        assertEquals(1, config.threshold());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.workers());
        assertEquals(DedupConfig.KEEP_OLDEST, config.keepStrategy());
        assertEquals(DedupConfig.ACTION_DRY_RUN, config.actionStrategy());
        assertEquals(DedupConfig.HASH_DIFFERENCE, config.hashAlgorithm());
        assertEquals(List.of(".jpg", ".jpeg", ".png", ".gif"), config.allowedExtensions());
    }

    @Test
    void testExtensionsAreNormalized() {
        DedupConfig config = DedupConfig.defaults().withAllowedExtensions(List.of("JPG", ".Png", " webp "));

        assertEquals(List.of(".jpg", ".png", ".webp"), config.allowedExtensions());
    }

    @Test
    void testTrashPathDefaultsUnderSource() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"));

        assertEquals(Path.of("/photos/.trash"), config.effectiveTrashPath());
        assertEquals(Path.of("/tmp/bin"), config.withTrashPath(Path.of("/tmp/bin")).effectiveTrashPath());
    }

    @Test
    void testEffectiveWorkers() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"));

        assertEquals(3, config.withWorkers(3).effectiveWorkers());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.withWorkers(0).effectiveWorkers());
    }

    // ==================== Validation ====================

    @Test
    void testValidConfigPasses() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos"));

        assertSame(config, config.validate());
    }

    @Test
    void testMissingSourceRejected() {
        assertThrows(IllegalArgumentException.class, () -> DedupConfig.defaults().validate());
    }

    @Test
    void testNegativeThresholdRejected() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos")).withThreshold(-1);

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void testEmptyExtensionsRejected() {
        DedupConfig config = DedupConfig.forSource(Path.of("/photos")).withAllowedExtensions(List.of());

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void testUnknownSelectorsRejected() {
        DedupConfig base = DedupConfig.forSource(Path.of("/photos"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> base.withKeepStrategy("keepNewest").validate());
        assertTrue(e.getMessage().contains("keepNewest"));

        assertThrows(IllegalArgumentException.class, () -> base.withActionStrategy("delete").validate());
        assertThrows(IllegalArgumentException.class, () -> base.withHashAlgorithm("wavelet").validate());
    }
}
