package com.candlegate.ingest.exchange;

import com.candlegate.core.model.FetchWindow;
import com.candlegate.core.model.Interval;
import com.candlegate.ingest.exchange.exception.ExchangeException;

/**
 * Narrow view of an exchange: one bounded page of OHLCV rows per call.
 * Pagination, retries and rate limiting belong to the caller.
 */
public interface ExchangeClient {

    /**
     * Identifier used in storage paths and manifests (e.g. "okx").
     */
    String getExchangeId();

    /**
     * Map an interval to the exchange's native timeframe token.
     * Example: 1h -> "1H" on OKX, "1h" on Binance
     */
    String timeframeToken(Interval interval);

    /**
     * Fetch up to {@code limit} bars starting at {@code since} (inclusive), oldest first.
     *
     * @param symbol   Trading pair in canonical BASE/QUOTE form (e.g. "BTC/USDT")
     * @param interval Bar interval
     * @param since    Start time in milliseconds
     * @param limit    Max rows for this request, capped at {@link #getMaxCandlesPerRequest()}
     * @return the page, with a next cursor while more rows may follow before the window end
     * @throws com.candlegate.ingest.exchange.exception.RateLimitException when throttled
     * @throws com.candlegate.ingest.exchange.exception.TransientNetworkException on network or 5xx failure
     */
    FetchWindow fetchWindow(String symbol, Interval interval, long since, int limit) throws ExchangeException;

    /**
     * Get max candles per request for this exchange.
     */
    int getMaxCandlesPerRequest();
}
