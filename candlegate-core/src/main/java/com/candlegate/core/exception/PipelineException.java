package com.candlegate.core.exception;

/**
 * Fatal data condition for one symbol batch.
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
