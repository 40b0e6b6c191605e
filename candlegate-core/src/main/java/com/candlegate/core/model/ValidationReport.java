package com.candlegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-batch data quality summary.
 * The validator fills row and missing-value counts; gap and outlier counts are
 * added by later stages through the {@code with*} copies.
 */
public record ValidationReport(
    @JsonProperty("total_rows") int totalRows,
    @JsonProperty("valid_rows") int validRows,
    @JsonProperty("outliers_detected") int outliersDetected,
    @JsonProperty("gaps_detected") int gapsDetected,
    @JsonProperty("missing_by_column") Map<String, Integer> missingByColumn,
    @JsonProperty("ohlc_violations") int ohlcViolations,   // Advisory only
    @JsonProperty("filled_rows") int filledRows            // Rows synthesized by gap repair
) {
    public ValidationReport {
        missingByColumn = missingByColumn == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(missingByColumn));
    }

    public static ValidationReport empty() {
        Map<String, Integer> missing = new LinkedHashMap<>();
        for (String column : RawBar.REQUIRED_COLUMNS) {
            missing.put(column, 0);
        }
        return new ValidationReport(0, 0, 0, 0, missing, 0, 0);
    }

    public ValidationReport withGaps(int gapsDetected, int filledRows) {
        return new ValidationReport(totalRows, validRows, outliersDetected, gapsDetected,
            missingByColumn, ohlcViolations, filledRows);
    }

    public ValidationReport withOutliers(int outliersDetected) {
        return new ValidationReport(totalRows, validRows, outliersDetected, gapsDetected,
            missingByColumn, ohlcViolations, filledRows);
    }

    /**
     * Total missing values across all required columns.
     */
    @JsonIgnore
    public int totalMissing() {
        return missingByColumn.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Fraction of rows missing a value in the given column.
     */
    public double missingRatio(String column) {
        if (totalRows == 0) return 0.0;
        return missingByColumn.getOrDefault(column, 0) / (double) totalRows;
    }
}
