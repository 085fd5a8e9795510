package io.imagededup;

import java.nio.file.Path;
import java.util.List;

/**
 * Computes perceptual fingerprints for image files.
 */
public interface PerceptualHasher {

    /**
     * Hashes every file it can.
     *
     * <p>Files that cannot be opened, decoded or fingerprinted are logged and
     * left out of the result; they never fail the batch.</p>
     *
     * @param paths Files to hash
     * @return One record per successfully hashed file, in no particular order
     */
    List<HashRecord> hashFiles(List<Path> paths);
}
