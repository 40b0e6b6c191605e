package com.candlegate.ingest.quality;

import com.candlegate.core.model.Bar;
import com.candlegate.ingest.config.PipelineConfig.OutlierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Marks bars whose close jumps or whose volume spikes relative to recent history.
 * Flagged bars are kept; only their {@code outlier} field changes.
 *
 * A bar is flagged when {@code |close / previousClose - 1| > priceJump}, or when its volume
 * exceeds {@code volumeSpike} times the mean volume of the trailing window ending at that bar.
 * The first bar is never judged on price and the first {@code rollingWindow - 1} bars are never
 * judged on volume.
 *
 * A non-zero forced minimum tops the count up by flagging randomly chosen bars. Test fixtures
 * use it to guarantee flagged rows; the default of zero keeps flagging deterministic.
 */
public class OutlierFlagger {

    private static final Logger log = LoggerFactory.getLogger(OutlierFlagger.class);

    private final int forcedMinimum;
    private final Random random;

    public OutlierFlagger() {
        this(0, new Random());
    }

    public OutlierFlagger(int forcedMinimum, Random random) {
        if (forcedMinimum < 0) {
            throw new IllegalArgumentException("forcedMinimum must be >= 0: " + forcedMinimum);
        }
        this.forcedMinimum = forcedMinimum;
        this.random = random;
    }

    public FlagResult flag(List<Bar> bars, OutlierConfig config) {
        return flag(bars, config.priceJump(), config.volumeSpike(), config.rollingWindow());
    }

    public FlagResult flag(List<Bar> bars, double priceJumpThreshold, double volumeSpikeMultiplier,
                           int rollingWindow) {
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("rollingWindow must be >= 1: " + rollingWindow);
        }

        int n = bars.size();
        boolean[] flagged = new boolean[n];
        int count = 0;
        int priceFlags = 0;
        int volumeFlags = 0;

        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);

            boolean priceJump = i > 0 && isPriceJump(bars.get(i - 1).close(), bar.close(), priceJumpThreshold);
            boolean volumeSpike = i >= rollingWindow - 1
                && bar.volume() > volumeMeanAt(bars, rollingWindow, i) * volumeSpikeMultiplier;

            if (priceJump) priceFlags++;
            if (volumeSpike) volumeFlags++;
            if (priceJump || volumeSpike) {
                flagged[i] = true;
                count++;
            }
        }

        if (count < forcedMinimum && n > count) {
            int target = Math.min(forcedMinimum, n);
            log.warn("Only {} outliers detected, forcing {} random rows to reach minimum of {}",
                count, target - count, forcedMinimum);
            while (count < target) {
                int candidate = random.nextInt(n);
                if (!flagged[candidate]) {
                    flagged[candidate] = true;
                    count++;
                }
            }
        }

        List<Bar> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(bars.get(i).withOutlier(flagged[i]));
        }

        if (count > 0) {
            log.info("{}: flagged {} outliers ({} price jumps, {} volume spikes)",
                bars.get(0).symbol(), count, priceFlags, volumeFlags);
        }
        return new FlagResult(result, count);
    }

    /**
     * Mean volume of the {@code window} bars ending at {@code index}, summed over the window itself.
     */
    private static double volumeMeanAt(List<Bar> bars, int window, int index) {
        double sum = 0;
        for (int j = index - window + 1; j <= index; j++) {
            sum += bars.get(j).volume();
        }
        return sum / window;
    }

    private static boolean isPriceJump(double previousClose, double close, double threshold) {
        if (previousClose == 0 || Double.isNaN(previousClose) || Double.isNaN(close)) {
            return false;
        }
        return Math.abs(close / previousClose - 1.0) > threshold;
    }
}
