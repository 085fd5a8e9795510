package io.imagededup.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a {@link DedupConfig} from a YAML file.
 *
 * <p>Values live under a top-level {@code deduplicator} key. Missing values keep
 * the defaults of the base config:</p>
 * <pre>{@code
 * deduplicator:
 *   source: /photos
 *   threshold: 2
 *   actionStrategy: moveToTrash
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads a config file on top of {@link DedupConfig#defaults()}.
     */
    public DedupConfig load(Path path) throws IOException {
        return load(path, DedupConfig.defaults());
    }

    /**
     * Loads a config file on top of the given base config.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public DedupConfig load(Path path, DedupConfig base) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            DedupConfig config = load(is, base);
            log.info("Loaded configuration from {}", path);
            return config;
        }
    }

    public DedupConfig load(InputStream is, DedupConfig base) throws IOException {
        ConfigFile file = mapper.readValue(is, ConfigFile.class);
        if (file == null || file.deduplicator == null) {
            log.debug("No deduplicator section found, using defaults");
            return base;
        }
        return file.deduplicator.applyTo(base);
    }

    // ==================== File DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ConfigFile {
        @JsonProperty("deduplicator")
        public DeduplicatorSection deduplicator;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class DeduplicatorSection {
        @JsonProperty("source")
        public String source;

        @JsonProperty("allowedExtensions")
        public List<String> allowedExtensions;

        @JsonProperty("threshold")
        public Integer threshold;

        @JsonProperty("workers")
        public Integer workers;

        @JsonProperty("trashPath")
        public String trashPath;

        @JsonProperty("keepStrategy")
        public String keepStrategy;

        @JsonProperty("actionStrategy")
        public String actionStrategy;

        @JsonProperty("hashAlgorithm")
        public String hashAlgorithm;

        @JsonProperty("locale")
        public String locale;

        DedupConfig applyTo(DedupConfig config) {
            DedupConfig result = config;
            if (source != null && !source.isBlank()) result = result.withSource(Path.of(source));
            if (allowedExtensions != null && !allowedExtensions.isEmpty()) result = result.withAllowedExtensions(allowedExtensions);
            if (threshold != null) result = result.withThreshold(threshold);
            if (workers != null) result = result.withWorkers(workers);
            if (trashPath != null && !trashPath.isBlank()) result = result.withTrashPath(Path.of(trashPath));
            if (keepStrategy != null && !keepStrategy.isBlank()) result = result.withKeepStrategy(keepStrategy);
            if (actionStrategy != null && !actionStrategy.isBlank()) result = result.withActionStrategy(actionStrategy);
            if (hashAlgorithm != null && !hashAlgorithm.isBlank()) result = result.withHashAlgorithm(hashAlgorithm);
            if (locale != null && !locale.isBlank()) result = result.withLocale(locale);
            return result;
        }
    }
}
