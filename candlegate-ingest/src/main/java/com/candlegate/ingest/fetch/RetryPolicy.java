package com.candlegate.ingest.fetch;

import java.time.Duration;

/**
 * Exponential backoff: attempt n (starting at 0) waits {@code base * 2^n} before the next try.
 *
 * @param maxAttempts total attempts including the first one
 * @param base        backoff base
 */
public record RetryPolicy(int maxAttempts, Duration base) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base must be >= 0: " + base);
        }
    }

    public static RetryPolicy of(int maxAttempts, double baseSeconds) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(Math.round(baseSeconds * 1000)));
    }

    public Duration delayFor(int attempt) {
        // Cap the shift to keep the multiplier from overflowing
        return base.multipliedBy(1L << Math.min(attempt, 20));
    }

    public boolean isLastAttempt(int attempt) {
        return attempt >= maxAttempts - 1;
    }
}
