package io.imagededup.hash;

import java.util.Objects;

/**
 * Fixed-width perceptual fingerprint of an image.
 */
public record Fingerprint(
    /** Name of the algorithm that produced the bits */
    String algorithm,

    /** The bit vector, right-aligned */
    long bits,

    /** Number of significant bits (1-64) */
    int bitLength
) {
    public Fingerprint {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        if (bitLength < 1 || bitLength > Long.SIZE) {
            throw new IllegalArgumentException("bitLength must be in 1..64, got " + bitLength);
        }
        if (bitLength < Long.SIZE && (bits >>> bitLength) != 0) {
            throw new IllegalArgumentException("bits exceed bitLength " + bitLength);
        }
    }

    /**
     * Number of differing bits between this fingerprint and another.
     *
     * @throws IncompatibleFingerprintException if algorithm or width differ
     */
    public int hammingDistance(Fingerprint other) {
        if (!algorithm.equals(other.algorithm) || bitLength != other.bitLength) {
            throw new IncompatibleFingerprintException(this, other);
        }
        return Long.bitCount(bits ^ other.bits);
    }

    /**
     * Hex form of the bits, zero-padded to the fingerprint width.
     */
    public String toHex() {
        int digits = (bitLength + 3) / 4;
        String hex = Long.toHexString(bits);
        return "0".repeat(Math.max(0, digits - hex.length())) + hex;
    }

    @Override
    public String toString() {
        return algorithm + ":" + toHex();
    }
}
