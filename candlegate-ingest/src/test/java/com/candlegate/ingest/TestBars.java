package com.candlegate.ingest;

import com.candlegate.core.model.Bar;
import com.candlegate.core.model.RawBar;
import com.candlegate.ingest.config.ConfigLoader;
import com.candlegate.ingest.config.PipelineConfig;
import com.candlegate.ingest.config.PipelineConfig.GapFillConfig;
import com.candlegate.ingest.config.PipelineConfig.OutlierConfig;
import com.candlegate.ingest.config.PipelineConfig.ValidationConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic series shared by the ingest tests.
 */
public final class TestBars {

    public static final String SYMBOL = "BTC/USDT";
    public static final long T0 = 1_704_067_200_000L;  // 2024-01-01T00:00:00Z
    public static final long MINUTE = 60_000L;

    private TestBars() {
    }

    /**
     * Flat, consistent raw rows: close 100, volume 10.
     */
    public static List<RawBar> rawSeries(long start, long stepMs, int count) {
        List<RawBar> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(RawBar.of(start + i * stepMs, 100, 101, 99, 100, 10));
        }
        return rows;
    }

    public static List<Bar> barSeries(long start, long stepMs, int count) {
        List<Bar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(new Bar(SYMBOL, start + i * stepMs, 100, 101, 99, 100, 10));
        }
        return bars;
    }

    public static Bar bar(long timestamp, double close, double volume) {
        return new Bar(SYMBOL, timestamp, close, close, close, close, volume);
    }

    public static ValidationConfig validation(double missingThreshold, boolean strictOhlc) {
        return new ValidationConfig(missingThreshold, strictOhlc, new GapFillConfig(15),
            new OutlierConfig(0.2, 5.0, 96, 0));
    }

    public static PipelineConfig defaults() {
        return ConfigLoader.defaults();
    }
}
