package com.candlegate.ingest.quality;

import com.candlegate.core.model.Bar;

import java.util.List;

/**
 * Bars with outlier flags set, and how many were flagged.
 */
public record FlagResult(List<Bar> bars, int count) {

    public FlagResult {
        bars = List.copyOf(bars);
    }
}
