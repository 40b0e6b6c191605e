package com.candlegate.ingest.quality;

import com.candlegate.core.model.Bar;
import com.candlegate.core.model.Gap;
import com.candlegate.core.model.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Repairs missing values and missing timestamps in a sorted series.
 *
 * Missing fields of an observed row are forward-filled from the previous bar (leading rows
 * take the first later finite value). Missing timestamps are detected by walking consecutive
 * bars: runs no longer than the short-gap limit are flat-filled, longer runs are only counted.
 */
public class GapRepairer {

    private static final Logger log = LoggerFactory.getLogger(GapRepairer.class);

    // Jitter allowed on top of one interval before a step counts as missing
    private static final double TOLERANCE_FRACTION = 0.01;

    /**
     * @param bars             bars sorted ascending with unique timestamps
     * @param expectedInterval nominal bar spacing
     * @param shortGapMinutes  gaps whose missing duration is at most this long are filled
     */
    public RepairResult repair(List<Bar> bars, Interval expectedInterval, int shortGapMinutes) {
        if (bars.isEmpty()) {
            return new RepairResult(List.of(), 0, 0, List.of());
        }

        List<Bar> imputed = imputeMissingValues(bars);

        long step = expectedInterval.millis();
        long tolerance = (long) (step * TOLERANCE_FRACTION);
        long shortGapMs = shortGapMinutes * 60_000L;

        List<Bar> repaired = new ArrayList<>(imputed.size());
        List<Gap> gaps = new ArrayList<>();
        int gapsDetected = 0;
        int filledRows = 0;

        Bar previous = null;
        for (Bar bar : imputed) {
            if (previous != null) {
                long delta = bar.timestamp() - previous.timestamp();
                if (delta > step + tolerance) {
                    int missing = (int) Math.round((double) delta / step) - 1;
                    if (missing > 0) {
                        long firstMissing = previous.timestamp() + step;
                        long lastMissing = previous.timestamp() + missing * step;
                        if (missing * step <= shortGapMs) {
                            for (int k = 1; k <= missing; k++) {
                                repaired.add(previous.synthesizedAt(previous.timestamp() + k * step));
                            }
                            filledRows += missing;
                            gaps.add(new Gap(firstMissing, lastMissing, missing, true));
                        } else {
                            gapsDetected += missing;
                            gaps.add(new Gap(firstMissing, lastMissing, missing, false));
                            log.warn("{}: {} missing bars between {} and {} left unfilled",
                                bar.symbol(), missing, previous.instant(), bar.instant());
                        }
                    }
                }
            }
            repaired.add(bar);
            previous = bar;
        }

        if (!gaps.isEmpty()) {
            log.info("{}: {} gaps, {} rows filled, {} steps unfilled",
                imputed.get(0).symbol(), gaps.size(), filledRows, gapsDetected);
        }
        return new RepairResult(repaired, gapsDetected, filledRows, gaps);
    }

    private static List<Bar> imputeMissingValues(List<Bar> bars) {
        Bar seed = firstFiniteValues(bars);
        List<Bar> result = new ArrayList<>(bars.size());
        int imputed = 0;

        Bar previous = null;
        for (Bar bar : bars) {
            Bar current = bar;
            if (bar.hasMissingValues()) {
                current = bar.imputedFrom(previous != null ? previous : seed);
                imputed++;
            }
            result.add(current);
            previous = current;
        }

        if (imputed > 0) {
            log.info("{}: imputed missing values in {} rows", bars.get(0).symbol(), imputed);
        }
        return result;
    }

    /**
     * Bar holding, per field, the first finite value in the series (NaN if there is none).
     */
    private static Bar firstFiniteValues(List<Bar> bars) {
        double open = Double.NaN, high = Double.NaN, low = Double.NaN, close = Double.NaN, volume = Double.NaN;
        for (Bar b : bars) {
            if (Double.isNaN(open)) open = b.open();
            if (Double.isNaN(high)) high = b.high();
            if (Double.isNaN(low)) low = b.low();
            if (Double.isNaN(close)) close = b.close();
            if (Double.isNaN(volume)) volume = b.volume();
        }
        Bar first = bars.get(0);
        return new Bar(first.symbol(), first.timestamp(), open, high, low, close, volume);
    }
}
