package com.candlegate.ingest.quality;

import com.candlegate.core.exception.QualityThresholdException;
import com.candlegate.core.exception.SchemaException;
import com.candlegate.core.model.Bar;
import com.candlegate.core.model.RawBar;
import com.candlegate.core.model.ValidationReport;
import com.candlegate.ingest.config.PipelineConfig.ValidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a normalized batch of raw rows and converts it to typed bars.
 *
 * <ol>
 *   <li>Schema: every required column must appear in at least one row.</li>
 *   <li>Missing values: per-column ratio must not exceed the configured threshold.</li>
 *   <li>OHLC consistency: advisory unless strict mode drops offending rows.</li>
 * </ol>
 * Missing values stay NaN in the output; gap repair imputes them.
 */
public class BarValidator {

    private static final Logger log = LoggerFactory.getLogger(BarValidator.class);

    public ValidationResult validate(String symbol, List<RawBar> rows, ValidationConfig config)
            throws SchemaException, QualityThresholdException {
        if (rows.isEmpty()) {
            return ValidationResult.empty();
        }

        checkSchema(rows);

        int total = rows.size();
        Map<String, Integer> missing = countMissing(rows);
        for (String column : RawBar.REQUIRED_COLUMNS) {
            double ratio = missing.get(column) / (double) total;
            if (ratio > config.missingThreshold()) {
                log.error("{}: column '{}' missing {} of {} values", symbol, column, missing.get(column), total);
                throw new QualityThresholdException(column, ratio, config.missingThreshold());
            }
        }

        List<Bar> bars = new ArrayList<>(total);
        int violations = 0;
        for (RawBar row : rows) {
            Bar bar = toBar(symbol, row);
            if (!bar.hasMissingValues() && !bar.isOhlcConsistent()) {
                violations++;
                log.warn("{}: inconsistent OHLC at {} (o={} h={} l={} c={} v={})", symbol, bar.instant(),
                    bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
                if (config.strictOhlc()) {
                    continue;
                }
            }
            bars.add(bar);
        }

        ValidationReport report = new ValidationReport(total, bars.size(), 0, 0, missing, violations, 0);
        if (violations > 0) {
            log.warn("{}: {} rows violate OHLC consistency{}", symbol, violations,
                config.strictOhlc() ? " and were dropped" : "");
        }
        log.info("{}: validated {} rows, {} valid, {} missing values", symbol, total, bars.size(),
            report.totalMissing());
        return new ValidationResult(bars, report);
    }

    private static void checkSchema(List<RawBar> rows) throws SchemaException {
        List<String> absent = new ArrayList<>();
        for (String column : RawBar.REQUIRED_COLUMNS) {
            boolean present = rows.stream().anyMatch(r -> r.hasColumn(column));
            if (!present) {
                absent.add(column);
            }
        }
        if (!absent.isEmpty()) {
            throw new SchemaException(absent);
        }
    }

    private static Map<String, Integer> countMissing(List<RawBar> rows) {
        Map<String, Integer> missing = new LinkedHashMap<>();
        for (String column : RawBar.REQUIRED_COLUMNS) {
            int count = 0;
            for (RawBar row : rows) {
                if (row.isMissing(column)) {
                    count++;
                }
            }
            missing.put(column, count);
        }
        return missing;
    }

    private static Bar toBar(String symbol, RawBar row) {
        return new Bar(symbol, row.timestamp(),
            row.get(RawBar.OPEN),
            row.get(RawBar.HIGH),
            row.get(RawBar.LOW),
            row.get(RawBar.CLOSE),
            row.get(RawBar.VOLUME));
    }
}
