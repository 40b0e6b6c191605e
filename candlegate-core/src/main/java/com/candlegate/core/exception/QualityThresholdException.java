package com.candlegate.core.exception;

import java.util.Locale;

/**
 * Thrown when the fraction of missing values in a required column exceeds the configured threshold.
 */
public class QualityThresholdException extends PipelineException {

    private final String column;
    private final double missingRatio;
    private final double threshold;

    public QualityThresholdException(String column, double missingRatio, double threshold) {
        super(String.format(Locale.ROOT, "Missing data exceeds threshold in '%s': %.4f > %.4f",
            column, missingRatio, threshold));
        this.column = column;
        this.missingRatio = missingRatio;
        this.threshold = threshold;
    }

    public String getColumn() {
        return column;
    }

    public double getMissingRatio() {
        return missingRatio;
    }

    public double getThreshold() {
        return threshold;
    }
}
