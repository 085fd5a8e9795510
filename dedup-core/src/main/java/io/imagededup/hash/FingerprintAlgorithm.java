package io.imagededup.hash;

import java.awt.image.BufferedImage;

/**
 * Computes a perceptual fingerprint from decoded pixels.
 *
 * <p>Implementations must be thread-safe; one instance is shared by all hashing
 * workers.</p>
 */
public interface FingerprintAlgorithm {

    /**
     * Returns the algorithm for a configuration selector.
     *
     * @param name "difference" or "average"
     */
    static FingerprintAlgorithm forName(String name) {
        return switch (name) {
            case DifferenceHash.NAME -> new DifferenceHash();
            case AverageHash.NAME -> new AverageHash();
            default -> throw new IllegalArgumentException("Unknown hash algorithm: " + name +
                ". Use: " + DifferenceHash.NAME + ", " + AverageHash.NAME);
        };
    }

    /**
     * Name stored in every produced {@link Fingerprint}.
     */
    String name();

    Fingerprint compute(BufferedImage image);
}
