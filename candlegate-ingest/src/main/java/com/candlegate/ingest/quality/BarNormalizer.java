package com.candlegate.ingest.quality;

import com.candlegate.core.model.RawBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts raw exchange rows into canonical order: unique timestamps, ascending.
 * When a timestamp repeats, the first row seen wins.
 */
public class BarNormalizer {

    private static final Logger log = LoggerFactory.getLogger(BarNormalizer.class);

    public List<RawBar> normalize(List<RawBar> rows) {
        if (rows.isEmpty()) {
            return new ArrayList<>();
        }

        Map<Long, RawBar> byTimestamp = new LinkedHashMap<>();
        for (RawBar row : rows) {
            byTimestamp.putIfAbsent(row.timestamp(), row);
        }

        List<RawBar> normalized = new ArrayList<>(byTimestamp.values());
        normalized.sort(Comparator.comparingLong(RawBar::timestamp));

        int dropped = rows.size() - normalized.size();
        if (dropped > 0) {
            log.debug("Dropped {} duplicate rows out of {}", dropped, rows.size());
        }
        return normalized;
    }
}
