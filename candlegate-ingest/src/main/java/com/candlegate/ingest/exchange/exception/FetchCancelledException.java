package com.candlegate.ingest.exchange.exception;

/**
 * A fetch was cancelled by the caller or ran past its deadline.
 */
public class FetchCancelledException extends ExchangeException {

    private final boolean deadlineExceeded;

    public FetchCancelledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
