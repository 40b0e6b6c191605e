package com.candlegate.core.exception;

import java.util.List;

/**
 * Thrown when required columns are absent from a batch altogether.
 */
public class SchemaException extends PipelineException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
