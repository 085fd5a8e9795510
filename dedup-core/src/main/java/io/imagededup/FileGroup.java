package io.imagededup;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Candidate files bucketed by exact byte size.
 *
 * <p>Each bucket holds at least two paths; buckets with a single file can never
 * contain a duplicate and are dropped by the scanner.</p>
 */
public record FileGroup(List<List<Path>> buckets) {

    public FileGroup {
        if (buckets == null) {
            buckets = List.of();
        }
        List<List<Path>> copy = new ArrayList<>(buckets.size());
        for (List<Path> bucket : buckets) {
            if (bucket.size() < 2) {
                throw new IllegalArgumentException("bucket must contain at least 2 paths, got " + bucket.size());
            }
            copy.add(List.copyOf(bucket));
        }
        buckets = List.copyOf(copy);
    }

    public static FileGroup empty() {
        return new FileGroup(List.of());
    }

    /**
     * Returns all candidate paths, bucket after bucket.
     */
    public List<Path> flatten() {
        List<Path> flat = new ArrayList<>(fileCount());
        for (List<Path> bucket : buckets) {
            flat.addAll(bucket);
        }
        return flat;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int fileCount() {
        return buckets.stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
