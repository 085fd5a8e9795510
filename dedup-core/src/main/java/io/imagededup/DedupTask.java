package io.imagededup;

import io.imagededup.action.ActionResource;
import io.imagededup.action.ActionStrategies;
import io.imagededup.action.ImageFile;
import io.imagededup.action.ResolutionStrategy;
import io.imagededup.config.DedupConfig;
import io.imagededup.fs.FileSystem;
import io.imagededup.group.DistanceGrouper;
import io.imagededup.hash.ConcurrentPerceptualHasher;
import io.imagededup.hash.FingerprintAlgorithm;
import io.imagededup.hash.ImageIoDecoder;
import io.imagededup.i18n.BundleLocalizer;
import io.imagededup.i18n.Localizer;
import io.imagededup.keep.KeepPolicies;
import io.imagededup.keep.KeepPolicy;
import io.imagededup.scan.SizeCandidateScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs the whole deduplication pipeline.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DedupConfig config = DedupConfig.forSource(Path.of("/photos"))
 *     .withActionStrategy(DedupConfig.ACTION_MOVE_TO_TRASH);
 * DedupSummary summary = DedupTask.create(config).run();
 * }</pre>
 *
 * <p>A run goes: strategy setup, scan, flatten, hash, group, then for every
 * group a keep decision and one strategy call per file to remove, and finally
 * teardown. Scan failures abort the run before any file is touched; a failed
 * action is logged and the run moves on.</p>
 *
 * <p>The strategy is built lazily from the factory and cached for the action
 * selector it was built for. Asking for a different selector rebuilds it.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public class DedupTask {

    private static final Logger log = LoggerFactory.getLogger(DedupTask.class);

    private final DedupConfig config;
    private final Localizer localizer;
    private final CandidateScanner scanner;
    private final PerceptualHasher hasher;
    private final DuplicateGrouper grouper;
    private final KeepPolicy keepPolicy;
    private final Function<String, ResolutionStrategy> strategyFactory;

    private String lastActionStrategy;
    private ResolutionStrategy cachedStrategy;

    public DedupTask(
            DedupConfig config,
            Localizer localizer,
            CandidateScanner scanner,
            PerceptualHasher hasher,
            DuplicateGrouper grouper,
            KeepPolicy keepPolicy,
            Function<String, ResolutionStrategy> strategyFactory) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.localizer = Objects.requireNonNull(localizer, "localizer cannot be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner cannot be null");
        this.hasher = Objects.requireNonNull(hasher, "hasher cannot be null");
        this.grouper = Objects.requireNonNull(grouper, "grouper cannot be null");
        this.keepPolicy = Objects.requireNonNull(keepPolicy, "keepPolicy cannot be null");
        this.strategyFactory = Objects.requireNonNull(strategyFactory, "strategyFactory cannot be null");
    }

    /**
     * Creates a task wired with the default implementations: local filesystem,
     * ImageIO decoding, the configured fingerprint algorithm and the message
     * bundle for the configured locale.
     *
     * @throws IllegalArgumentException if the config is invalid
     */
    public static DedupTask create(DedupConfig config) {
        config.validate();
        FileSystem fileSystem = FileSystem.local();
        Localizer localizer = BundleLocalizer.forLanguage(config.locale());

        return new DedupTask(
            config,
            localizer,
            new SizeCandidateScanner(config.allowedExtensions(), fileSystem, localizer),
            new ConcurrentPerceptualHasher(
                config.effectiveWorkers(),
                fileSystem,
                new ImageIoDecoder(),
                FingerprintAlgorithm.forName(config.hashAlgorithm()),
                localizer),
            new DistanceGrouper(config.threshold(), localizer),
            KeepPolicies.forName(config.keepStrategy(), fileSystem),
            selector -> ActionStrategies.create(config.withActionStrategy(selector), fileSystem, localizer)
        );
    }

    // ==================== Running ====================

    /**
     * Runs the pipeline with the configured action strategy.
     *
     * @throws IOException if the source cannot be scanned or the strategy's
     *         resource cannot be set up
     */
    public DedupSummary run() throws IOException {
        return run(config.actionStrategy());
    }

    /**
     * Runs the pipeline with the given action strategy instead of the configured one.
     */
    public DedupSummary run(String actionStrategy) throws IOException {
        ResolutionStrategy strategy = strategyFor(actionStrategy);
        ActionResource resource = strategy.getResources();

        if (resource != null) {
            try {
                resource.setup();
            } catch (IOException e) {
                throw new IOException(localizer.translate("ActionStrategyError") + ": " + e.getMessage(), e);
            }
        }

        try {
            Analysis analysis = analyze();
            return resolve(analysis, strategy);
        } finally {
            if (resource != null) {
                teardown(resource);
            }
        }
    }

    /**
     * Scans, hashes and groups without resolving anything.
     */
    public List<DuplicateGroup> findDuplicates() throws IOException {
        return analyze().groups();
    }

    /**
     * Applies the configured keep policy to a group.
     */
    public ActionDecision decide(DuplicateGroup group) {
        return keepPolicy.decide(group.paths());
    }

    // ==================== Pipeline stages ====================

    private Analysis analyze() throws IOException {
        FileGroup candidates = scanner.scan(config.source());
        List<Path> files = candidates.flatten();
        log.debug("Flattened {} size buckets into {} candidates", candidates.bucketCount(), files.size());

        List<HashRecord> hashes = hasher.hashFiles(files);
        List<DuplicateGroup> groups = grouper.group(hashes);
        return new Analysis(files.size(), hashes.size(), groups);
    }

    private DedupSummary resolve(Analysis analysis, ResolutionStrategy strategy) {
        List<DuplicateGroup> groups = analysis.groups();
        if (groups.isEmpty()) {
            log.info(localizer.translate("SummaryNoDuplicates"));
            return new DedupSummary(analysis.candidates(), analysis.hashed(), 0, 0, 0);
        }

        int filesToRemove = 0;
        int failedActions = 0;
        for (DuplicateGroup group : groups) {
            ActionDecision decision = decide(group);
            filesToRemove += decision.remove().size();

            log.info(localizer.translate("DuplicateGroupFound",
                Map.of("ToKeep", decision.keep(), "ToRemoveCount", decision.remove().size())));

            ImageFile keep = ImageFile.of(decision.keep());
            for (Path removePath : decision.remove()) {
                if (!execute(strategy, keep, ImageFile.of(removePath))) {
                    failedActions++;
                }
            }
        }

        log.info(localizer.translate("SummaryDuplicatesFound",
            Map.of("Groups", groups.size(), "Files", filesToRemove)));
        return new DedupSummary(analysis.candidates(), analysis.hashed(), groups.size(), filesToRemove, failedActions);
    }

    private boolean execute(ResolutionStrategy strategy, ImageFile keep, ImageFile remove) {
        try {
            strategy.execute(keep, remove);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error(localizer.translate("ActionFailed",
                Map.of("ToKeep", keep.path(), "ToRemove", remove.path(), "Error", String.valueOf(e.getMessage()))));
            return false;
        }
    }

    private void teardown(ActionResource resource) {
        try {
            resource.teardown();
        } catch (IOException | RuntimeException e) {
            log.warn("Action resource teardown failed: {}", e.getMessage(), e);
        }
    }

    // ==================== Strategy cache ====================

    ResolutionStrategy strategyFor(String actionStrategy) {
        if (cachedStrategy == null || !Objects.equals(lastActionStrategy, actionStrategy)) {
            log.debug("Building action strategy '{}'", actionStrategy);
            cachedStrategy = Objects.requireNonNull(strategyFactory.apply(actionStrategy),
                "strategyFactory returned null for " + actionStrategy);
            lastActionStrategy = actionStrategy;
        }
        return cachedStrategy;
    }

    private record Analysis(int candidates, int hashed, List<DuplicateGroup> groups) {}
}
