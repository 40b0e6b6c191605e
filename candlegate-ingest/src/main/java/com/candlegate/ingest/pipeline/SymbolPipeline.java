package com.candlegate.ingest.pipeline;

import com.candlegate.core.exception.PipelineException;
import com.candlegate.core.model.Bar;
import com.candlegate.core.model.FetchWindow;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.Manifest;
import com.candlegate.core.model.RawBar;
import com.candlegate.core.model.ValidationReport;
import com.candlegate.ingest.config.PipelineConfig;
import com.candlegate.ingest.exchange.exception.ExchangeException;
import com.candlegate.ingest.fetch.CancellationToken;
import com.candlegate.ingest.fetch.CandleFetcher;
import com.candlegate.ingest.quality.BarNormalizer;
import com.candlegate.ingest.quality.BarValidator;
import com.candlegate.ingest.quality.FlagResult;
import com.candlegate.ingest.quality.GapRepairer;
import com.candlegate.ingest.quality.OutlierFlagger;
import com.candlegate.ingest.quality.RepairResult;
import com.candlegate.ingest.quality.ValidationResult;
import com.candlegate.ingest.store.PartitionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Runs one symbol through fetch, normalize, validate, repair, flag and store, in that order.
 * Each stage returns a new list; nothing is written unless every earlier stage succeeded.
 */
public class SymbolPipeline {

    private static final Logger log = LoggerFactory.getLogger(SymbolPipeline.class);

    private final PipelineConfig config;
    private final Interval interval;
    private final CandleFetcher fetcher;
    private final BarNormalizer normalizer;
    private final BarValidator validator;
    private final GapRepairer repairer;
    private final OutlierFlagger flagger;
    private final PartitionedStore store;

    public SymbolPipeline(PipelineConfig config, CandleFetcher fetcher, PartitionedStore store) {
        this(config, fetcher, new BarNormalizer(), new BarValidator(), new GapRepairer(),
            new OutlierFlagger(config.validation().outliers().forcedMinimum(), new Random()), store);
    }

    public SymbolPipeline(PipelineConfig config, CandleFetcher fetcher, BarNormalizer normalizer,
                          BarValidator validator, GapRepairer repairer, OutlierFlagger flagger,
                          PartitionedStore store) {
        this.config = config;
        this.interval = Interval.parse(config.interval());
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.validator = validator;
        this.repairer = repairer;
        this.flagger = flagger;
        this.store = store;
    }

    public Interval getInterval() {
        return interval;
    }

    /**
     * Ingest {@code [start, end)} for one symbol.
     *
     * @throws PipelineException      on schema, threshold or empty-data failures
     * @throws ExchangeException      when fetching fails for good, or the run is cancelled
     * @throws IOException            when the store cannot write
     */
    public PipelineResult run(String symbol, long start, long end, CancellationToken token)
            throws PipelineException, ExchangeException, IOException {
        log.info("{} {}: ingesting {} to {}", symbol, interval, Instant.ofEpochMilli(start), Instant.ofEpochMilli(end));

        List<RawBar> raw = fetchAll(symbol, start, end, token);
        List<RawBar> normalized = normalizer.normalize(raw);

        var validation = config.validation();
        ValidationResult validated = validator.validate(symbol, normalized, validation);
        RepairResult repaired = repairer.repair(validated.bars(), interval, validation.gapFill().shortGap());
        FlagResult flagged = flagger.flag(repaired.bars(), validation.outliers());

        ValidationReport report = validated.report()
            .withGaps(repaired.gapsDetected(), repaired.filledRows())
            .withOutliers(flagged.count());

        token.throwIfCancelled();
        List<Bar> bars = flagged.bars();
        Manifest manifest = store.write(bars, symbol, interval, report);

        log.info("{} {}: stored {} rows ({} valid, {} filled, {} gap steps, {} outliers)", symbol, interval,
            manifest.rowCount(), report.validRows(), report.filledRows(), report.gapsDetected(),
            report.outliersDetected());
        return new PipelineResult(symbol, manifest, report, repaired.gaps());
    }

    private List<RawBar> fetchAll(String symbol, long start, long end, CancellationToken token)
            throws ExchangeException {
        List<RawBar> rows = new ArrayList<>();
        long cursor = start;
        int pages = 0;

        while (cursor < end) {
            token.throwIfCancelled();
            FetchWindow window = fetcher.fetch(symbol, interval, cursor, end, token);
            rows.addAll(window.rows());
            pages++;
            log.debug("{} {}: page {} returned {} rows", symbol, interval, pages, window.rows().size());

            if (!window.hasMore() || window.nextCursor().getAsLong() <= cursor) {
                break;
            }
            cursor = window.nextCursor().getAsLong();
        }

        log.info("{} {}: fetched {} rows in {} pages", symbol, interval, rows.size(), pages);
        return rows;
    }
}
