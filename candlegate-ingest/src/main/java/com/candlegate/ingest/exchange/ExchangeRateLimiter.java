package com.candlegate.ingest.exchange;

/**
 * Paces requests to one exchange. A single instance is shared by every symbol pipeline
 * talking to that exchange.
 *
 * Callers reserve a slot and then wait for it themselves, so the wait can be cut short by
 * cancellation without holding the limiter.
 */
public interface ExchangeRateLimiter {

    /**
     * Reserve the next request slot if it starts within {@code maxWaitMs}.
     *
     * @return milliseconds to wait before sending, or -1 if no slot is free in time
     *         (nothing is reserved in that case)
     */
    long reserve(long maxWaitMs);

    /**
     * Minimum spacing between two requests in milliseconds.
     */
    long getMinDelayMs();

    int getRequestsPerMinute();

    static ExchangeRateLimiter fixedDelay(long delayMs) {
        return new FixedDelayRateLimiter(delayMs);
    }
}

/**
 * Hands out slots at least delayMs apart, in reservation order across all threads.
 */
class FixedDelayRateLimiter implements ExchangeRateLimiter {
    private final long delayMs;
    private long nextFreeSlot = 0;

    FixedDelayRateLimiter(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0: " + delayMs);
        }
        this.delayMs = delayMs;
    }

    @Override
    public synchronized long reserve(long maxWaitMs) {
        long now = System.currentTimeMillis();
        long slot = Math.max(now, nextFreeSlot);
        long wait = slot - now;
        if (wait > maxWaitMs) {
            return -1;
        }
        nextFreeSlot = slot + delayMs;
        return wait;
    }

    @Override
    public long getMinDelayMs() {
        return delayMs;
    }

    @Override
    public int getRequestsPerMinute() {
        return delayMs == 0 ? Integer.MAX_VALUE : (int) (60_000 / delayMs);
    }
}
