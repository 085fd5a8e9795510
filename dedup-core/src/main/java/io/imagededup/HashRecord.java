package io.imagededup;

import io.imagededup.hash.Fingerprint;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate file paired with its perceptual fingerprint.
 */
public record HashRecord(
    Path path,
    Fingerprint fingerprint
) {
    public HashRecord {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
    }
}
