package com.candlegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptor of the last successful write for one (exchange, symbol, interval) directory.
 * Written as manifest.json after every partition it lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Manifest(
    @JsonProperty("exchange_id") String exchangeId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("interval") String interval,
    @JsonProperty("start_timestamp") String startTimestamp,   // ISO-8601 UTC
    @JsonProperty("end_timestamp") String endTimestamp,       // ISO-8601 UTC
    @JsonProperty("fetch_timestamp") String fetchTimestamp,   // ISO-8601 UTC
    @JsonProperty("version") String version,
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("partitions") List<PartitionEntry> partitions,
    @JsonProperty("validation") ValidationReport validation
) {
    public static final String FORMAT_VERSION = "1.0.0";
    public static final String FILE_NAME = "manifest.json";

    public Manifest {
        partitions = partitions == null ? List.of() : List.copyOf(partitions);
    }

    public Manifest withValidation(ValidationReport report) {
        return new Manifest(exchangeId, symbol, interval, startTimestamp, endTimestamp,
            fetchTimestamp, version, rowCount, partitions, report);
    }
}
