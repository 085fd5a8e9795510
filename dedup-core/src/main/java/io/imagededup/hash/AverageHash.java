package io.imagededup.hash;

import java.awt.image.BufferedImage;

/**
 * 64-bit average hash: 8x8 grayscale, bit set where a pixel is at least the mean.
 */
public class AverageHash implements FingerprintAlgorithm {

    public static final String NAME = "average";

    private static final int SIZE = 8;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Fingerprint compute(BufferedImage image) {
        int[] gray = ScaledGrayscale.pixels(image, SIZE, SIZE);

        long sum = 0;
        for (int v : gray) {
            sum += v;
        }
        double mean = (double) sum / gray.length;

        long bits = 0;
        for (int v : gray) {
            bits <<= 1;
            if (v >= mean) {
                bits |= 1;
            }
        }
        return new Fingerprint(NAME, bits, SIZE * SIZE);
    }
}
