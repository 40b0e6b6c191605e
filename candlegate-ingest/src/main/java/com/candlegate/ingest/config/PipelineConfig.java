package com.candlegate.ingest.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable pipeline configuration, passed explicitly into every stage.
 * Loaded from YAML by {@link ConfigLoader}.
 *
 * <pre>
 * exchange_id: okx
 * interval: 15min
 * symbols: [BTC/USDT, ETH/USDT]
 * storage:
 *   root: /data/candlegate
 * data_collection:
 *   api: { rate_limit: 100, retries: 3, backoff_base: 1.0 }
 * data_validation:
 *   missing_threshold: 0.05
 *   gap_fill: { short_gap: 15 }
 *   outliers: { price_jump: 0.2, volume_spike: 5.0, rolling_window: 96 }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("exchange_id") String exchangeId,
    @JsonProperty("interval") String interval,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("storage") StorageConfig storage,
    @JsonProperty("data_collection") CollectionConfig collection,
    @JsonProperty("data_validation") ValidationConfig validation
) {
    public PipelineConfig {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    public PipelineConfig withStorageRoot(Path root) {
        return new PipelineConfig(exchangeId, interval, symbols,
            new StorageConfig(root.toString(), storage.format()), collection, validation);
    }

    public PipelineConfig withValidation(ValidationConfig validation) {
        return new PipelineConfig(exchangeId, interval, symbols, storage, collection, validation);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StorageConfig(
        @JsonProperty("root") String root,
        @JsonProperty("format") String format
    ) {
        public Path rootPath() {
            return Path.of(root);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollectionConfig(
        @JsonProperty("api") ApiConfig api,
        @JsonProperty("max_concurrent_symbols") int maxConcurrentSymbols,
        @JsonProperty("symbol_timeout_seconds") long symbolTimeoutSeconds,
        @JsonProperty("lookback_days") int lookbackDays
    ) {
    }

    /**
     * Exchange API settings.
     *
     * @param rateLimit         minimum milliseconds between requests to the exchange
     * @param retries           total attempts per request window
     * @param backoffBase       seconds; attempt n waits backoffBase * 2^n
     * @param maxRowsPerRequest page size cap
     * @param timeoutSeconds    HTTP connect/read timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiConfig(
        @JsonProperty("rate_limit") long rateLimit,
        @JsonProperty("retries") int retries,
        @JsonProperty("backoff_base") double backoffBase,
        @JsonProperty("max_rows_per_request") int maxRowsPerRequest,
        @JsonProperty("timeout_seconds") long timeoutSeconds
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("missing_threshold") double missingThreshold,
        @JsonProperty("strict_ohlc") boolean strictOhlc,
        @JsonProperty("gap_fill") GapFillConfig gapFill,
        @JsonProperty("outliers") OutlierConfig outliers
    ) {
    }

    /**
     * @param shortGap minutes; missing runs up to this duration are forward-filled
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GapFillConfig(
        @JsonProperty("short_gap") int shortGap
    ) {
    }

    /**
     * @param forcedMinimum test-fixture aid: flag random rows until at least this many are flagged.
     *                      0 disables it and keeps flagging deterministic.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutlierConfig(
        @JsonProperty("price_jump") double priceJump,
        @JsonProperty("volume_spike") double volumeSpike,
        @JsonProperty("rolling_window") int rollingWindow,
        @JsonProperty("forced_minimum") int forcedMinimum
    ) {
    }
}
