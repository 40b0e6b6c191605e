package com.candlegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One calendar-day file described by a manifest.
 */
public record PartitionEntry(
    @JsonProperty("date") String date,          // YYYY-MM-DD (UTC)
    @JsonProperty("file") String file,          // File name relative to the manifest directory
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("sha256") String sha256
) {
}
