package com.candlegate.core.model;

import java.util.List;
import java.util.OptionalLong;

/**
 * One page of raw rows from an exchange.
 *
 * @param rows       rows in the order the exchange returned them (oldest first)
 * @param nextCursor timestamp to request the next page from, empty when the page was not full
 */
public record FetchWindow(List<RawBar> rows, OptionalLong nextCursor) {

    public FetchWindow {
        rows = List.copyOf(rows);
    }

    public static FetchWindow empty() {
        return new FetchWindow(List.of(), OptionalLong.empty());
    }

    public boolean hasMore() {
        return nextCursor.isPresent();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
