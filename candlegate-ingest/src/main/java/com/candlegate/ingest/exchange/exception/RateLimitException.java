package com.candlegate.ingest.exchange.exception;

public class RateLimitException extends ExchangeException {

    private final long retryAfterMs;

    public RateLimitException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    /**
     * Server-requested wait before retrying, 0 when the exchange gave none.
     */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
