package io.imagededup.group;

import io.imagededup.DuplicateGroup;
import io.imagededup.HashRecord;
import io.imagededup.hash.DistanceFunction;
import io.imagededup.hash.Fingerprint;
import io.imagededup.i18n.BundleLocalizer;
import io.imagededup.i18n.Localizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DistanceGrouperTest {

    private Localizer localizer;

    @BeforeEach
    void setUp() {
        localizer = BundleLocalizer.forLanguage("en");
    }

    // ==================== Grouping ====================

    @Test
    void testEmptyInput() {
        assertTrue(new DistanceGrouper(1, localizer).group(List.of()).isEmpty());
    }

    @Test
    void testIdenticalFingerprintsFormOneGroup() {
        List<HashRecord> records = List.of(record("a", 0b1111), record("b", 0b1111), record("c", 0b1111));

        List<DuplicateGroup> groups = new DistanceGrouper(0, localizer).group(records);

        assertEquals(1, groups.size());
        assertEquals(List.of(path("a"), path("b"), path("c")), groups.get(0).paths());
    }

    @Test
    void testDistanceBoundaryIsInclusive() {
        // C is 5 bits from A and B
        List<HashRecord> records = List.of(record("a", 0), record("b", 0), record("c", 0b11111));

        List<DuplicateGroup> strict = new DistanceGrouper(4, localizer).group(records);
        assertEquals(1, strict.size());
        assertEquals(List.of(path("a"), path("b")), strict.get(0).paths());

        List<DuplicateGroup> loose = new DistanceGrouper(5, localizer).group(records);
        assertEquals(1, loose.size());
        assertEquals(3, loose.get(0).size());
    }

    @Test
    void testNonTransitiveChainFollowsInputOrder() {
        // A~B (2), B~C (2), A!~C (4)
        HashRecord a = record("a", 0b0000);
        HashRecord b = record("b", 0b0011);
        HashRecord c = record("c", 0b1111);

        List<DuplicateGroup> groups = new DistanceGrouper(2, localizer).group(List.of(a, b, c));

        assertEquals(1, groups.size());
        assertEquals(List.of(path("a"), path("b")), groups.get(0).paths());
    }

    @Test
    void testUnmatchedBaseStaysAvailable() {
        // A matches nothing as a base; B then collects C
        HashRecord a = record("a", 0b11110000);
        HashRecord b = record("b", 0b00000001);
        HashRecord c = record("c", 0b00000011);

        List<DuplicateGroup> groups = new DistanceGrouper(1, localizer).group(List.of(a, b, c));

        assertEquals(1, groups.size());
        assertEquals(List.of(path("b"), path("c")), groups.get(0).paths());
    }

    @Test
    void testNoPathInTwoGroupsAndNoSingletons() {
        Random random = new Random(42);
        List<HashRecord> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            records.add(record("img" + i, random.nextInt(64)));
        }

        List<DuplicateGroup> groups = new DistanceGrouper(2, localizer).group(records);

        Set<Path> seen = new HashSet<>();
        for (DuplicateGroup group : groups) {
            assertTrue(group.size() >= 2);
            for (Path p : group.paths()) {
                assertTrue(seen.add(p), "Path in two groups: " + p);
            }
        }
        assertFalse(groups.isEmpty());
    }

    // ==================== Failures ====================

    @Test
    void testComparisonFailureIsSkipped() {
        HashRecord a = record("a", 0);
        HashRecord b = new HashRecord(path("b"), new Fingerprint("average", 0, 64));
        HashRecord c = record("c", 0);

        List<DuplicateGroup> groups = new DistanceGrouper(0, localizer).group(List.of(a, b, c));

        assertEquals(1, groups.size());
        assertEquals(List.of(path("a"), path("c")), groups.get(0).paths());
    }

    @Test
    void testCustomDistanceFunctionThatThrows() {
        DistanceFunction failing = (x, y) -> {
            throw new IllegalStateException("broken");
        };
        List<HashRecord> records = List.of(record("a", 0), record("b", 0));

        assertTrue(new DistanceGrouper(10, failing, localizer).group(records).isEmpty());
    }

    @Test
    void testThresholdIsExposed() {
        assertEquals(3, new DistanceGrouper(3, localizer).getThreshold());
    }

    @Test
    void testNegativeThresholdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DistanceGrouper(-1, localizer));
    }

    private static HashRecord record(String name, long bits) {
        return new HashRecord(path(name), new Fingerprint("difference", bits, 64));
    }

    private static Path path(String name) {
        return Path.of("/photos", name + ".jpg");
    }
}
