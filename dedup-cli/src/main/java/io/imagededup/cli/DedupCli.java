package io.imagededup.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.imagededup.ActionDecision;
import io.imagededup.DedupSummary;
import io.imagededup.DedupTask;
import io.imagededup.DuplicateGroup;
import io.imagededup.config.ConfigLoader;
import io.imagededup.config.DedupConfig;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the image deduplicator.
 *
 * <p>Exit codes: 0 on success, 1 when the run fails, 2 on bad arguments or config.</p>
 */
@Command(
    name = "imagededup",
    mixinStandardHelpOptions = true,
    version = "image-dedup 1.0.0",
    description = "Find and resolve perceptually duplicate images",
    subcommands = {
        DedupCli.DedupCommand.class,
        DedupCli.GroupsCommand.class
    }
)
public class DedupCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new DedupCli());
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    /**
     * Options shared by every subcommand that builds a {@link DedupConfig}.
     */
    static class ConfigOptions {

        @Parameters(index = "0", arity = "0..1",
            description = "Directory to scan for images (default: 'source' from the config file)")
        Path source;

        @Option(names = {"-c", "--config"}, description = "YAML config file (values under 'deduplicator:')")
        Path configFile;

        @Option(names = {"-t", "--threshold"}, description = "Maximum Hamming distance for two images to match")
        Integer threshold;

        @Option(names = {"-w", "--workers"}, description = "Number of hashing threads (0 = CPU count)")
        Integer workers;

        @Option(names = {"-k", "--keep"}, description = "Keep policy: keepOldest, keepShortestPath")
        String keep;

        @Option(names = {"--hash"}, description = "Fingerprint algorithm: difference, average")
        String hash;

        @Option(names = {"-e", "--ext"}, split = ",", description = "Allowed extensions, e.g. .jpg,.png")
        List<String> extensions;

        @Option(names = {"-l", "--locale"}, description = "Language of log messages, e.g. en, de")
        String locale;

        /**
         * Defaults, then the config file, then explicit options.
         */
        DedupConfig toConfig() throws IOException {
            DedupConfig config = DedupConfig.defaults();
            if (configFile != null) {
                config = new ConfigLoader().load(configFile, config);
            }
            if (source != null) {
                config = config.withSource(source);
            }
            if (threshold != null) {
                config = config.withThreshold(threshold);
            }
            if (workers != null) {
                config = config.withWorkers(workers);
            }
            if (keep != null) {
                config = config.withKeepStrategy(keep);
            }
            if (hash != null) {
                config = config.withHashAlgorithm(hash);
            }
            if (extensions != null && !extensions.isEmpty()) {
                config = config.withAllowedExtensions(extensions);
            }
            if (locale != null) {
                config = config.withLocale(locale);
            }
            return config;
        }
    }

    /**
     * Full run: find duplicates and resolve them.
     */
    @Command(
        name = "dedup",
        description = "Find duplicate images and resolve them with the chosen action"
    )
    static class DedupCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Mixin
        private ConfigOptions options = new ConfigOptions();

        @Option(names = {"-a", "--action"}, description = "Action: dryRun, moveToTrash")
        private String action;

        @Option(names = {"--trash"}, description = "Trash directory (default: <source>/.trash)")
        private Path trash;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            DedupTask task;
            try {
                DedupConfig config = options.toConfig();
                if (action != null) {
                    config = config.withActionStrategy(action);
                }
                if (trash != null) {
                    config = config.withTrashPath(trash);
                }
                task = DedupTask.create(config);
            } catch (IllegalArgumentException | IOException e) {
                err.println("Invalid configuration: " + e.getMessage());
                return EXIT_USAGE;
            }

            try {
                DedupSummary summary = task.run();
                out.println();
                out.println("Deduplication Summary");
                out.println("=".repeat(40));
                out.println("Candidates: " + summary.candidates());
                out.println("Hashed: " + summary.hashed());
                out.println("Duplicate groups: " + summary.groups());
                out.println("Files to remove: " + summary.filesToRemove());
                out.println("Failed actions: " + summary.failedActions());
                out.flush();
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Deduplication failed: " + e.getMessage());
                return EXIT_RUN_FAILED;
            }
        }
    }

    /**
     * Report duplicate groups without touching any file.
     */
    @Command(
        name = "groups",
        description = "List duplicate groups without resolving them"
    )
    static class GroupsCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Mixin
        private ConfigOptions options = new ConfigOptions();

        @Option(names = {"--json"}, description = "Print groups as JSON")
        private boolean json;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            DedupTask task;
            try {
                task = DedupTask.create(options.toConfig());
            } catch (IllegalArgumentException | IOException e) {
                err.println("Invalid configuration: " + e.getMessage());
                return EXIT_USAGE;
            }

            try {
                List<GroupReport> reports = task.findDuplicates().stream()
                    .map(group -> GroupReport.of(group, task.decide(group)))
                    .toList();

                if (json) {
                    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                    out.println(mapper.writeValueAsString(reports));
                } else {
                    printReports(out, reports);
                }
                out.flush();
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Scan failed: " + e.getMessage());
                return EXIT_RUN_FAILED;
            }
        }

        private void printReports(PrintWriter out, List<GroupReport> reports) {
            out.println();
            out.println("Found " + reports.size() + " duplicate groups:");
            out.println("=".repeat(60));

            for (GroupReport report : reports) {
                out.println();
                out.printf("[%d similar images]%n", report.size());
                out.println("  keep:   " + report.keep());
                for (String path : report.remove()) {
                    out.println("  remove: " + path);
                }
            }
        }
    }

    /**
     * JSON shape of one group. Paths are plain strings so Jackson does not
     * render them as file URIs.
     */
    public record GroupReport(int size, String keep, List<String> remove) {

        static GroupReport of(DuplicateGroup group, ActionDecision decision) {
            return new GroupReport(
                group.size(),
                String.valueOf(decision.keep()),
                decision.remove().stream().map(Path::toString).toList()
            );
        }
    }
}
