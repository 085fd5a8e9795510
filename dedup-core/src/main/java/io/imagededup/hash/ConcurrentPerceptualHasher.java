package io.imagededup.hash;

import io.imagededup.HashRecord;
import io.imagededup.PerceptualHasher;
import io.imagededup.fs.FileSystem;
import io.imagededup.i18n.Localizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link PerceptualHasher} running a fixed pool of workers over a shared work queue.
 *
 * <p>Workers take paths from a bounded queue and publish to two result queues,
 * one for fingerprints and one for failures. Nothing else is shared between
 * threads. A failure affects only its own file: it is logged and counted, never
 * retried.</p>
 *
 * <p>Interrupting the calling thread cancels the workers; the records finished
 * so far are returned and the interrupt flag is restored.</p>
 */
public class ConcurrentPerceptualHasher implements PerceptualHasher {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentPerceptualHasher.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int workers;
    private final FileSystem fileSystem;
    private final ImageDecoder decoder;
    private final FingerprintAlgorithm algorithm;
    private final Localizer localizer;

    /**
     * Creates a hasher.
     *
     * @param workers Maximum number of worker threads; 0 or less uses one per processor
     */
    public ConcurrentPerceptualHasher(
            int workers,
            FileSystem fileSystem,
            ImageDecoder decoder,
            FingerprintAlgorithm algorithm,
            Localizer localizer) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
        this.workers = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    @Override
    public List<HashRecord> hashFiles(List<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            return new ArrayList<>();
        }

        log.info(localizer.translate("HashingStarted", Map.of("Count", paths.size())));

        BlockingQueue<Path> jobs = new ArrayBlockingQueue<>(paths.size(), false, paths);
        BlockingQueue<HashRecord> results = new LinkedBlockingQueue<>();
        BlockingQueue<HashFailure> failures = new LinkedBlockingQueue<>();

        int poolSize = Math.min(workers, paths.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreadFactory());

        List<Callable<Void>> tasks = new ArrayList<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            tasks.add(() -> {
                runWorker(jobs, results, failures);
                return null;
            });
        }

        try {
            reportWorkerFailures(pool.invokeAll(tasks));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Hashing interrupted with {} of {} files done", results.size() + failures.size(), paths.size());
        } finally {
            pool.shutdownNow();
        }

        return collect(results, failures, paths.size());
    }

    public int getWorkers() {
        return workers;
    }

    // ==================== Workers ====================

    private void runWorker(BlockingQueue<Path> jobs, BlockingQueue<HashRecord> results,
                           BlockingQueue<HashFailure> failures) {
        Path path;
        while (!Thread.currentThread().isInterrupted() && (path = jobs.poll()) != null) {
            try {
                results.add(hashFile(path));
            } catch (Exception | Error e) {
                // an Error (e.g. OutOfMemoryError on a huge image) only loses this file
                log.warn(localizer.translate("PHashError", Map.of("Path", path, "Error", describe(e))));
                failures.add(new HashFailure(path, e));
            }
        }
    }

    private HashRecord hashFile(Path path) throws IOException {
        try (InputStream in = new BufferedInputStream(fileSystem.open(path))) {
            BufferedImage image = decoder.decode(in);
            return new HashRecord(path, algorithm.compute(image));
        }
    }

    private static void reportWorkerFailures(List<Future<Void>> done) throws InterruptedException {
        for (Future<Void> future : done) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Hashing worker stopped unexpectedly", e.getCause());
            } catch (CancellationException e) {
                log.debug("Hashing worker was cancelled");
            }
        }
    }

    // ==================== Collection ====================

    private List<HashRecord> collect(BlockingQueue<HashRecord> results, BlockingQueue<HashFailure> failures,
                                     int total) {
        List<HashRecord> records = new ArrayList<>(total);
        List<HashFailure> failed = new ArrayList<>();
        results.drainTo(records);
        failures.drainTo(failed);

        for (HashFailure failure : failed) {
            log.debug("Not hashed: {}", failure.path(), failure.error());
        }

        log.info(localizer.translate("HashingFinished",
            Map.of("Count", records.size(), "Total", total, "Failed", failed.size())));
        return records;
    }

    private static ThreadFactory workerThreadFactory() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadId = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dedup-hasher-" + poolId + "-" + threadId.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record HashFailure(Path path, Throwable error) {}
}
