package io.imagededup.hash;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;

/**
 * {@link ImageDecoder} using the JDK's {@code javax.imageio} readers
 * (GIF, JPEG, PNG, BMP, WBMP).
 */
public class ImageIoDecoder implements ImageDecoder {

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(InputStream in) throws ImageDecodeException {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new ImageDecodeException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format");
        }
        return image;
    }
}
