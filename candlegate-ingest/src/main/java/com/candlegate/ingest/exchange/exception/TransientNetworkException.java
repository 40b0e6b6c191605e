package com.candlegate.ingest.exchange.exception;

/**
 * Timeouts, dropped connections and 5xx responses.
 */
public class TransientNetworkException extends ExchangeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
