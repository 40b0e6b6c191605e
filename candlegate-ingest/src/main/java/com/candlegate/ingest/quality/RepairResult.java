package com.candlegate.ingest.quality;

import com.candlegate.core.model.Bar;
import com.candlegate.core.model.Gap;
import com.candlegate.core.model.Provenance;

import java.util.List;

/**
 * Output of gap repair.
 *
 * @param bars         repaired series, ascending
 * @param gapsDetected missing steps left unfilled (long gaps only)
 * @param filledRows   rows synthesized for short gaps
 * @param gaps         every gap found, filled or not
 */
public record RepairResult(List<Bar> bars, int gapsDetected, int filledRows, List<Gap> gaps) {

    public RepairResult {
        bars = List.copyOf(bars);
        gaps = List.copyOf(gaps);
    }

    public int imputedRows() {
        return (int) bars.stream().filter(b -> b.provenance() == Provenance.IMPUTED).count();
    }
}
