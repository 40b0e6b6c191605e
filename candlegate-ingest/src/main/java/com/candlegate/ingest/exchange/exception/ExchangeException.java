package com.candlegate.ingest.exchange.exception;

public class ExchangeException extends Exception {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether retrying the same request may succeed.
     */
    public boolean isRecoverable() {
        return false;
    }
}
