package com.candlegate.ingest.config;

import com.candlegate.core.model.Interval;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link PipelineConfig} from YAML.
 *
 * Built-in defaults come from the classpath resource {@code candlegate-defaults.yaml}; a user
 * file is merged over them key by key. The user file and the storage root can be pointed to by
 * system property or environment variable:
 * <ul>
 *   <li>{@code candlegate.config} / {@code CANDLEGATE_CONFIG}: path of the YAML file</li>
 *   <li>{@code candlegate.data.dir} / {@code CANDLEGATE_DATA_DIR}: storage root</li>
 * </ul>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/candlegate-defaults.yaml";
    // Partitions are only ever written as CSV
    static final String STORAGE_FORMAT = "csv";
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.candlegate/data";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    /**
     * Load using system properties and environment, falling back to defaults.
     */
    public static PipelineConfig load() throws IOException {
        String configPath = System.getProperty("candlegate.config", System.getenv("CANDLEGATE_CONFIG"));
        String dataDir = System.getProperty("candlegate.data.dir", System.getenv("CANDLEGATE_DATA_DIR"));

        PipelineConfig config = configPath != null ? load(Paths.get(configPath)) : defaults();
        if (dataDir != null && !dataDir.isBlank()) {
            config = config.withStorageRoot(Paths.get(dataDir));
        }
        return config;
    }

    /**
     * Load a user file merged over the defaults.
     */
    public static PipelineConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        JsonNode user = YAML.readTree(file.toFile());
        log.info("Loaded pipeline configuration from {}", file);
        return merge(user);
    }

    public static PipelineConfig fromYaml(String yaml) throws IOException {
        return merge(YAML.readTree(yaml));
    }

    public static PipelineConfig defaults() {
        try {
            return merge(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Built-in defaults are unreadable", e);
        }
    }

    private static PipelineConfig merge(JsonNode user) throws IOException {
        ObjectNode tree = readDefaults();
        if (user != null && user.isObject()) {
            deepMerge(tree, (ObjectNode) user);
        }

        PipelineConfig config = YAML.treeToValue(tree, PipelineConfig.class);
        if (config.storage().root() == null || config.storage().root().isBlank()) {
            config = config.withStorageRoot(Paths.get(DEFAULT_DATA_DIR));
        }
        validate(config);
        return config;
    }

    private static ObjectNode readDefaults() throws IOException {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) YAML.readTree(in);
        }
    }

    /**
     * Merge {@code overrides} into {@code target}. Objects merge recursively, everything else replaces.
     */
    static void deepMerge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode existing = target.get(entry.getKey());
            if (existing instanceof ObjectNode existingObject && entry.getValue() instanceof ObjectNode overrideObject) {
                deepMerge(existingObject, overrideObject);
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
        }
    }

    private static void validate(PipelineConfig config) {
        var api = config.collection().api();
        var validation = config.validation();

        require(config.exchangeId() != null && !config.exchangeId().isBlank(), "exchange_id is required");
        require(config.interval() != null && !config.interval().isBlank(), "interval is required");
        try {
            Interval.parse(config.interval());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
        require(STORAGE_FORMAT.equalsIgnoreCase(config.storage().format()),
            "storage.format must be " + STORAGE_FORMAT + ", got " + config.storage().format());
        require(api.retries() >= 1, "data_collection.api.retries must be >= 1");
        require(api.rateLimit() >= 0, "data_collection.api.rate_limit must be >= 0");
        require(api.backoffBase() >= 0, "data_collection.api.backoff_base must be >= 0");
        require(api.maxRowsPerRequest() >= 1, "data_collection.api.max_rows_per_request must be >= 1");
        require(config.collection().maxConcurrentSymbols() >= 1, "data_collection.max_concurrent_symbols must be >= 1");
        require(validation.missingThreshold() >= 0 && validation.missingThreshold() <= 1,
            "data_validation.missing_threshold must be within [0, 1]");
        require(validation.gapFill().shortGap() >= 0, "data_validation.gap_fill.short_gap must be >= 0");
        require(validation.outliers().priceJump() > 0, "data_validation.outliers.price_jump must be > 0");
        require(validation.outliers().volumeSpike() > 0, "data_validation.outliers.volume_spike must be > 0");
        require(validation.outliers().rollingWindow() >= 1, "data_validation.outliers.rolling_window must be >= 1");
        require(validation.outliers().forcedMinimum() >= 0, "data_validation.outliers.forced_minimum must be >= 0");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid configuration: " + message);
        }
    }
}
