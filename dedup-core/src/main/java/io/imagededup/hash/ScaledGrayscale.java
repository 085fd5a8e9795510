package io.imagededup.hash;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;

/**
 * Downsamples an image to a tiny grayscale grid.
 */
final class ScaledGrayscale {

    private ScaledGrayscale() {
    }

    /**
     * Returns {@code width * height} luminance values (0-255), row by row.
     */
    static int[] pixels(BufferedImage source, int width, int height) {
        if (source == null) {
            throw new IllegalArgumentException("image cannot be null");
        }
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        Raster raster = scaled.getRaster();
        int[] out = new int[width * height];
        raster.getPixels(0, 0, width, height, out);
        return out;
    }
}
