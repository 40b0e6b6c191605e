package com.candlegate.ingest.quality;

import com.candlegate.core.model.Bar;
import com.candlegate.core.model.ValidationReport;

import java.util.List;

/**
 * Typed bars that passed validation together with the batch report.
 */
public record ValidationResult(List<Bar> bars, ValidationReport report) {

    public ValidationResult {
        bars = List.copyOf(bars);
    }

    public static ValidationResult empty() {
        return new ValidationResult(List.of(), ValidationReport.empty());
    }
}
