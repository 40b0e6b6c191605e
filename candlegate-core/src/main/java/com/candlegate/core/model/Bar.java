package com.candlegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * One OHLCV observation for a symbol at a point in time.
 * Stored as CSV in {root}/EXCHANGE/SYMBOL/INTERVAL/YYYY-MM-DD.csv
 *
 * Missing prices or volume are represented as NaN until gap repair imputes them.
 * Instances are never mutated; stages derive new bars instead.
 */
public record Bar(
    String symbol,
    long timestamp,          // Bar open time, epoch millis UTC
    double open,
    double high,
    double low,
    double close,
    double volume,
    Provenance provenance,
    boolean outlier
) {
    public static final String CSV_HEADER = "timestamp,open,high,low,close,volume,provenance,is_outlier";

    /**
     * Observed bar, not flagged.
     */
    public Bar(String symbol, long timestamp, double open, double high, double low, double close, double volume) {
        this(symbol, timestamp, open, high, low, close, volume, Provenance.OBSERVED, false);
    }

    public Bar {
        if (provenance == null) {
            provenance = Provenance.OBSERVED;
        }
    }

    @JsonIgnore
    public Instant instant() {
        return Instant.ofEpochMilli(timestamp);
    }

    /**
     * True if any price or the volume is NaN.
     */
    @JsonIgnore
    public boolean hasMissingValues() {
        return Double.isNaN(open) || Double.isNaN(high) || Double.isNaN(low)
            || Double.isNaN(close) || Double.isNaN(volume);
    }

    /**
     * Check high/low bracket open and close, and volume is not negative.
     * Bars with missing values are never consistent.
     */
    @JsonIgnore
    public boolean isOhlcConsistent() {
        if (hasMissingValues()) return false;
        return high >= Math.max(Math.max(open, close), low)
            && low <= Math.min(Math.min(open, close), high)
            && volume >= 0;
    }

    @JsonIgnore
    public boolean isSynthesized() {
        return provenance == Provenance.SYNTHESIZED;
    }

    public Bar withOutlier(boolean flagged) {
        if (flagged == outlier) return this;
        return new Bar(symbol, timestamp, open, high, low, close, volume, provenance, flagged);
    }

    /**
     * Copy of this bar with missing fields taken from {@code source}.
     * Returns this bar unchanged if nothing was missing.
     */
    public Bar imputedFrom(Bar source) {
        if (!hasMissingValues()) return this;
        return new Bar(symbol, timestamp,
            Double.isNaN(open) ? source.open : open,
            Double.isNaN(high) ? source.high : high,
            Double.isNaN(low) ? source.low : low,
            Double.isNaN(close) ? source.close : close,
            Double.isNaN(volume) ? source.volume : volume,
            Provenance.IMPUTED, outlier);
    }

    /**
     * Flat-filled bar at {@code timestamp} carrying this bar's prices with zero volume.
     */
    public Bar synthesizedAt(long timestamp) {
        return new Bar(symbol, timestamp, open, high, low, close, 0.0, Provenance.SYNTHESIZED, false);
    }

    /**
     * Parse a partition CSV line.
     * Format: timestamp,open,high,low,close,volume[,provenance,is_outlier]
     */
    public static Bar fromCsv(String symbol, String line) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }

        Provenance provenance = Provenance.OBSERVED;
        boolean outlier = false;
        if (parts.length >= 7) {
            provenance = Provenance.valueOf(parts[6].trim().toUpperCase(Locale.ROOT));
        }
        if (parts.length >= 8) {
            outlier = Boolean.parseBoolean(parts[7].trim());
        }

        return new Bar(symbol,
            Long.parseLong(parts[0].trim()),
            Double.parseDouble(parts[1].trim()),
            Double.parseDouble(parts[2].trim()),
            Double.parseDouble(parts[3].trim()),
            Double.parseDouble(parts[4].trim()),
            Double.parseDouble(parts[5].trim()),
            provenance, outlier);
    }

    /**
     * Values are written in shortest exact form, so {@link #fromCsv} returns the same doubles.
     */
    public String toCsv() {
        return timestamp + "," + plain(open) + "," + plain(high) + "," + plain(low) + ","
            + plain(close) + "," + plain(volume) + ","
            + provenance.name().toLowerCase(Locale.ROOT) + "," + outlier;
    }

    // No exponent notation; NaN stays "NaN"
    private static String plain(double value) {
        return Double.isFinite(value) ? BigDecimal.valueOf(value).toPlainString() : Double.toString(value);
    }
}
