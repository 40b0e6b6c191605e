package com.candlegate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loosely-typed row as returned by an exchange.
 * Any column may be absent or hold NaN; the validator decides what that means.
 */
public record RawBar(
    long timestamp,               // Epoch millis UTC
    Map<String, Double> values    // Column name -> value
) {
    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";
    public static final String VOLUME = "volume";

    public static final List<String> REQUIRED_COLUMNS = List.of(OPEN, HIGH, LOW, CLOSE, VOLUME);

    public RawBar {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Row with all five OHLCV columns present.
     */
    public static RawBar of(long timestamp, double open, double high, double low, double close, double volume) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(OPEN, open);
        values.put(HIGH, high);
        values.put(LOW, low);
        values.put(CLOSE, close);
        values.put(VOLUME, volume);
        return new RawBar(timestamp, values);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * Value of a column, NaN when absent or null.
     */
    public double get(String column) {
        Double v = values.get(column);
        return v == null ? Double.NaN : v;
    }

    public boolean isMissing(String column) {
        return Double.isNaN(get(column));
    }
}
