package com.candlegate.ingest.pipeline;

import com.candlegate.core.model.Gap;
import com.candlegate.core.model.Manifest;
import com.candlegate.core.model.ValidationReport;

import java.util.List;

/**
 * Outcome of one successful symbol run.
 *
 * @param gaps every gap found during repair, filled or not
 */
public record PipelineResult(String symbol, Manifest manifest, ValidationReport report, List<Gap> gaps) {

    public PipelineResult {
        gaps = List.copyOf(gaps);
    }
}
