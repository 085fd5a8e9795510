package io.imagededup.group;

import io.imagededup.DuplicateGroup;
import io.imagededup.DuplicateGrouper;
import io.imagededup.HashRecord;
import io.imagededup.hash.DistanceFunction;
import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Greedy single-pass clustering of fingerprints by distance.
 *
 * <p>Each unassigned record in turn becomes the base of a candidate group and
 * collects every later unassigned record within {@code threshold} of the base.
 * Only candidate groups with two or more members are kept, and only their
 * members are marked as assigned; a base that matched nothing stays available
 * to later bases.</p>
 *
 * <p>The distance relation is not transitive, so the result depends on input
 * order: A~B and B~C with A!~C yields {A,B} and leaves C alone. This is
 * O(n²) in the number of records.</p>
 */
public class DistanceGrouper implements DuplicateGrouper {

    private static final Logger log = LoggerFactory.getLogger(DistanceGrouper.class);

    private final int threshold;
    private final DistanceFunction distance;
    private final Localizer localizer;

    public DistanceGrouper(int threshold, DistanceFunction distance, Localizer localizer) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative, got " + threshold);
        }
        this.threshold = threshold;
        this.distance = Objects.requireNonNull(distance, "distance cannot be null");
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
    }

    public DistanceGrouper(int threshold, Localizer localizer) {
        this(threshold, DistanceFunction.HAMMING, localizer);
    }

    @Override
    public List<DuplicateGroup> group(List<HashRecord> records) {
        log.info(localizer.translate("GroupingDuplicatesStarted"));

        List<DuplicateGroup> groups = new ArrayList<>();
        Set<Path> processed = new HashSet<>();

        for (int i = 0; i < records.size(); i++) {
            HashRecord base = records.get(i);
            if (processed.contains(base.path())) continue;

            List<Path> group = new ArrayList<>();
            group.add(base.path());

            for (int j = i + 1; j < records.size(); j++) {
                HashRecord other = records.get(j);
                if (processed.contains(other.path())) continue;

                if (withinThreshold(base, other)) {
                    group.add(other.path());
                }
            }

            if (group.size() > 1) {
                groups.add(new DuplicateGroup(group));
                processed.addAll(group);
            }
        }

        log.info(localizer.translate("GroupingDuplicatesFinished", Map.of("Count", groups.size())));
        return groups;
    }

    public int getThreshold() {
        return threshold;
    }

    private boolean withinThreshold(HashRecord a, HashRecord b) {
        try {
            return distance.distance(a.fingerprint(), b.fingerprint()) <= threshold;
        } catch (RuntimeException e) {
            // One bad pair must not stop the grouping
            log.warn(localizer.translate("HashCompareError",
                Map.of("File1", a.path(), "File2", b.path(), "Error", String.valueOf(e.getMessage()))));
            return false;
        }
    }
}
