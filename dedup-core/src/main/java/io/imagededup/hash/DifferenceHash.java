package io.imagededup.hash;

import java.awt.image.BufferedImage;

/**
 * 64-bit difference hash.
 *
 * <p>The image is shrunk to 9x8 grayscale; each bit records whether a pixel is
 * brighter than its right-hand neighbour. Robust against re-encoding, scaling
 * and uniform brightness changes.</p>
 */
public class DifferenceHash implements FingerprintAlgorithm {

    public static final String NAME = "difference";

    private static final int WIDTH = 9;
    private static final int HEIGHT = 8;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Fingerprint compute(BufferedImage image) {
        int[] gray = ScaledGrayscale.pixels(image, WIDTH, HEIGHT);

        long bits = 0;
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH - 1; x++) {
                bits <<= 1;
                int left = gray[y * WIDTH + x];
                int right = gray[y * WIDTH + x + 1];
                if (left > right) {
                    bits |= 1;
                }
            }
        }
        return new Fingerprint(NAME, bits, (WIDTH - 1) * HEIGHT);
    }
}
