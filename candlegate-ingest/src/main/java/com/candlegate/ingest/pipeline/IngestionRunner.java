package com.candlegate.ingest.pipeline;

import com.candlegate.ingest.config.PipelineConfig;
import com.candlegate.ingest.exchange.ExchangeClient;
import com.candlegate.ingest.exchange.ExchangeRateLimiter;
import com.candlegate.ingest.exchange.Symbols;
import com.candlegate.ingest.fetch.CancellationToken;
import com.candlegate.ingest.fetch.CandleFetcher;
import com.candlegate.ingest.store.PartitionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one {@link SymbolPipeline} per symbol on a bounded pool.
 *
 * All symbols share the pipeline's fetcher and therefore one rate limiter per exchange.
 * A failing symbol is recorded in the {@link BatchResult} and does not stop the others.
 */
public class IngestionRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final SymbolPipeline pipeline;
    private final int maxConcurrentSymbols;
    private final Duration symbolTimeout;
    private final AtomicReference<CancellationToken> currentBatch = new AtomicReference<>();

    public IngestionRunner(SymbolPipeline pipeline, int maxConcurrentSymbols, Duration symbolTimeout) {
        if (maxConcurrentSymbols < 1) {
            throw new IllegalArgumentException("maxConcurrentSymbols must be >= 1: " + maxConcurrentSymbols);
        }
        this.pipeline = pipeline;
        this.maxConcurrentSymbols = maxConcurrentSymbols;
        this.symbolTimeout = symbolTimeout;
    }

    /**
     * Wire a runner for one exchange from configuration.
     */
    public static IngestionRunner create(PipelineConfig config, ExchangeClient client) {
        var collection = config.collection();
        ExchangeRateLimiter limiter = ExchangeRateLimiter.fixedDelay(collection.api().rateLimit());
        CandleFetcher fetcher = new CandleFetcher(client, limiter, collection.api());
        PartitionedStore store = new PartitionedStore(config.storage().rootPath(), client.getExchangeId());
        SymbolPipeline pipeline = new SymbolPipeline(config, fetcher, store);
        Duration timeout = collection.symbolTimeoutSeconds() > 0
            ? Duration.ofSeconds(collection.symbolTimeoutSeconds())
            : null;
        return new IngestionRunner(pipeline, collection.maxConcurrentSymbols(), timeout);
    }

    public BatchResult runAll(List<String> symbols, long start, long end) {
        return runAll(symbols, start, end, null);
    }

    /**
     * Ingest every symbol over {@code [start, end)}.
     *
     * @param batchDeadline overall time limit, or null for none; each symbol also gets the
     *                      per-symbol timeout
     */
    public BatchResult runAll(List<String> symbols, long start, long end, Duration batchDeadline) {
        List<String> unique = List.copyOf(new LinkedHashSet<>(Symbols.normalizeAll(symbols)));
        Map<String, PipelineResult> succeeded = new LinkedHashMap<>();
        Map<String, Exception> failed = new LinkedHashMap<>();
        if (unique.isEmpty()) {
            return new BatchResult(succeeded, failed);
        }

        CancellationToken batch = batchDeadline != null
            ? CancellationToken.withTimeout(batchDeadline)
            : CancellationToken.create();
        currentBatch.set(batch);

        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(maxConcurrentSymbols, unique.size()), namedThreads());
        try {
            Map<String, Future<PipelineResult>> futures = new LinkedHashMap<>();
            for (String symbol : unique) {
                CancellationToken token = batch.child(symbolTimeout);
                futures.put(symbol, executor.submit(() -> pipeline.run(symbol, start, end, token)));
            }

            for (var entry : futures.entrySet()) {
                String symbol = entry.getKey();
                try {
                    succeeded.put(symbol, entry.getValue().get());
                } catch (ExecutionException e) {
                    Exception cause = e.getCause() instanceof Exception ex ? ex : e;
                    failed.put(symbol, cause);
                    log.error("{}: ingestion failed: {}", symbol, cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    batch.cancel();
                    failed.put(symbol, e);
                    log.error("{}: interrupted while waiting for result", symbol);
                }
            }
        } finally {
            executor.shutdownNow();
            currentBatch.compareAndSet(batch, null);
        }

        log.info("Batch complete: {} succeeded, {} failed", succeeded.size(), failed.size());
        return new BatchResult(succeeded, failed);
    }

    /**
     * Cancel the batch in progress. Symbols still fetching stop and write nothing.
     */
    public void cancel() {
        CancellationToken batch = currentBatch.get();
        if (batch != null) {
            log.info("Cancelling ingestion batch");
            batch.cancel();
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "candlegate-ingest-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
