package com.candlegate.core.exception;

public class EmptyDataException extends PipelineException {

    public EmptyDataException(String message) {
        super(message);
    }
}
