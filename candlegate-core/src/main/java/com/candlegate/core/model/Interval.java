package com.candlegate.core.model;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nominal spacing between consecutive bars, parsed from labels such as
 * "15min", "15m", "1h", "4H", "1d" or "1w".
 *
 * The label is kept as given because it names the storage directory and the manifest entry.
 */
public final class Interval {

    private static final Pattern LABEL = Pattern.compile("^(\\d+)\\s*(min|m|h|d|w)$");

    private final String label;
    private final int amount;
    private final char unit;     // 'm', 'h', 'd' or 'w'
    private final Duration duration;

    private Interval(String label, int amount, char unit, Duration duration) {
        this.label = label;
        this.amount = amount;
        this.unit = unit;
        this.duration = duration;
    }

    /**
     * Parse an interval label.
     *
     * @throws IllegalArgumentException if the label is not recognised or not positive
     */
    public static Interval parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Interval label is null");
        }
        String trimmed = label.trim();
        // "1M" is a month on most exchanges; not a fixed duration
        Matcher m = LABEL.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!m.matches() || trimmed.endsWith("M")) {
            throw new IllegalArgumentException("Unsupported interval: " + label);
        }

        int amount = Integer.parseInt(m.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + label);
        }

        return switch (m.group(2)) {
            case "min", "m" -> new Interval(trimmed, amount, 'm', Duration.ofMinutes(amount));
            case "h" -> new Interval(trimmed, amount, 'h', Duration.ofHours(amount));
            case "d" -> new Interval(trimmed, amount, 'd', Duration.ofDays(amount));
            case "w" -> new Interval(trimmed, amount, 'w', Duration.ofDays(7L * amount));
            default -> throw new IllegalArgumentException("Unsupported interval: " + label);
        };
    }

    public static Interval ofMinutes(int minutes) {
        return parse(minutes + "min");
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    public long millis() {
        return duration.toMillis();
    }

    public int amount() {
        return amount;
    }

    /**
     * Unit letter: 'm' minutes, 'h' hours, 'd' days, 'w' weeks.
     */
    public char unit() {
        return unit;
    }

    /**
     * Compact timeframe token ("15min" -> "15m", "1H" -> "1h").
     */
    public String timeframe() {
        return amount + String.valueOf(unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval other)) return false;
        return duration.equals(other.duration);
    }

    @Override
    public int hashCode() {
        return duration.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
