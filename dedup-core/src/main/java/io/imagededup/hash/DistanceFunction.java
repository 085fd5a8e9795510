package io.imagededup.hash;

/**
 * Distance between two fingerprints. Must be symmetric.
 */
@FunctionalInterface
public interface DistanceFunction {

    /** Bit-count distance, see {@link Fingerprint#hammingDistance(Fingerprint)}. */
    DistanceFunction HAMMING = Fingerprint::hammingDistance;

    /**
     * @throws IncompatibleFingerprintException if the fingerprints cannot be compared
     */
    int distance(Fingerprint a, Fingerprint b);
}
