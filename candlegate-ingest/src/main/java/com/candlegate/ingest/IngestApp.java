package com.candlegate.ingest;

import com.candlegate.core.model.Interval;
import com.candlegate.ingest.config.ConfigLoader;
import com.candlegate.ingest.config.PipelineConfig;
import com.candlegate.ingest.exchange.ExchangeClient;
import com.candlegate.ingest.exchange.HttpClientFactory;
import com.candlegate.ingest.exchange.OkxExchangeClient;
import com.candlegate.ingest.pipeline.BatchResult;
import com.candlegate.ingest.pipeline.IngestionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Ingests the configured symbols over the last {@code lookback_days}, aligned to the interval.
 * Exits with status 1 if any symbol failed.
 */
public class IngestApp {
    private static final Logger LOG = LoggerFactory.getLogger(IngestApp.class);
    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    public static void main(String[] args) {
        LOG.info("Starting Candlegate ingestion...");

        try {
            PipelineConfig config = ConfigLoader.load();
            ExchangeClient client = createClient(config);
            IngestionRunner runner = IngestionRunner.create(config, client);

            Runtime.getRuntime().addShutdownHook(new Thread(runner::cancel, "candlegate-shutdown"));

            long[] window = window(config, Instant.now());
            LOG.info("Exchange {} | interval {} | {} symbols | {} to {} | storage {}",
                config.exchangeId(), config.interval(), config.symbols().size(),
                Instant.ofEpochMilli(window[0]), Instant.ofEpochMilli(window[1]), config.storage().root());

            BatchResult result = runner.runAll(config.symbols(), window[0], window[1]);
            result.succeeded().forEach((symbol, r) -> LOG.info("OK     {} rows={} outliers={} gapSteps={}",
                symbol, r.manifest().rowCount(), r.report().outliersDetected(), r.report().gapsDetected()));
            result.failed().forEach((symbol, e) -> LOG.error("FAILED {} {}: {}",
                symbol, e.getClass().getSimpleName(), e.getMessage()));

            System.exit(result.isSuccess() ? 0 : 1);
        } catch (Exception e) {
            LOG.error("Ingestion failed to start", e);
            System.exit(1);
        }
    }

    static ExchangeClient createClient(PipelineConfig config) {
        if (!OkxExchangeClient.EXCHANGE_ID.equalsIgnoreCase(config.exchangeId())) {
            throw new IllegalArgumentException("Unsupported exchange: " + config.exchangeId());
        }
        return new OkxExchangeClient(
            HttpClientFactory.withTimeout(config.collection().api().timeoutSeconds()),
            OkxExchangeClient.DEFAULT_BASE_URL);
    }

    /**
     * [start, end) covering the lookback period. End is aligned down to the interval and start
     * down to UTC midnight, so the first date written is a complete day and replacing its
     * partition loses nothing stored by earlier runs.
     */
    static long[] window(PipelineConfig config, Instant now) {
        Interval interval = Interval.parse(config.interval());
        long end = now.toEpochMilli() - Math.floorMod(now.toEpochMilli(), interval.millis());
        long lookbackStart = end - Duration.ofDays(config.collection().lookbackDays()).toMillis();
        long start = lookbackStart - Math.floorMod(lookbackStart, DAY_MS);
        return new long[] {start, end};
    }
}
