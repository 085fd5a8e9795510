package io.imagededup.hash;

import java.io.IOException;

/**
 * Exception thrown when image bytes cannot be turned into pixels.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
