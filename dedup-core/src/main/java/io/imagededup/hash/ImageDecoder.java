package io.imagededup.hash;

import java.awt.image.BufferedImage;
import java.io.InputStream;

/**
 * Decodes encoded image bytes into a pixel grid.
 */
@FunctionalInterface
public interface ImageDecoder {

    /**
     * Decodes an image. The stream is not closed.
     *
     * @throws ImageDecodeException if the bytes are not a supported image
     */
    BufferedImage decode(InputStream in) throws ImageDecodeException;
}
