package com.candlegate.ingest.fetch;

import com.candlegate.core.model.FetchWindow;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.RawBar;
import com.candlegate.ingest.config.PipelineConfig.ApiConfig;
import com.candlegate.ingest.exchange.ExchangeClient;
import com.candlegate.ingest.exchange.ExchangeRateLimiter;
import com.candlegate.ingest.exchange.exception.ExchangeException;
import com.candlegate.ingest.exchange.exception.FetchCancelledException;
import com.candlegate.ingest.exchange.exception.RateLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

/**
 * Fetches one bounded window of raw bars, retrying recoverable failures with exponential backoff.
 *
 * A single call issues at most one successful request. When the returned window carries a
 * next cursor the caller requests the following page itself.
 */
public class CandleFetcher {

    private static final Logger log = LoggerFactory.getLogger(CandleFetcher.class);

    private final ExchangeClient client;
    private final ExchangeRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final int maxRowsPerRequest;
    private final Sleeper sleeper;

    public CandleFetcher(ExchangeClient client, ExchangeRateLimiter rateLimiter, ApiConfig api) {
        this(client, rateLimiter, RetryPolicy.of(api.retries(), api.backoffBase()), api.maxRowsPerRequest(),
            Sleeper.CANCELLABLE);
    }

    public CandleFetcher(ExchangeClient client, ExchangeRateLimiter rateLimiter, RetryPolicy retryPolicy,
                         int maxRowsPerRequest, Sleeper sleeper) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.maxRowsPerRequest = maxRowsPerRequest;
        this.sleeper = sleeper;
    }

    /**
     * Fetch rows in {@code [start, end)} starting at {@code start}.
     *
     * @param intervalLabel interval label such as "15min"
     * @return rows oldest first; next cursor present only while it is still before {@code end}
     * @throws RateLimitException         when throttled on every attempt
     * @throws FetchCancelledException    when the token is cancelled or its deadline passes
     * @throws ExchangeException          on any other exchange failure (not retried)
     */
    public FetchWindow fetch(String symbol, String intervalLabel, long start, long end, CancellationToken token)
            throws ExchangeException {
        return fetch(symbol, Interval.parse(intervalLabel), start, end, token);
    }

    public FetchWindow fetch(String symbol, Interval interval, long start, long end, CancellationToken token)
            throws ExchangeException {
        if (end <= start) {
            return FetchWindow.empty();
        }
        int limit = Math.min(maxRowsPerRequest, client.getMaxCandlesPerRequest());

        ExchangeException lastError = null;
        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            token.throwIfCancelled();
            acquirePermit(token);

            try {
                FetchWindow window = client.fetchWindow(symbol, interval, start, limit);
                return clip(window, start, end);
            } catch (ExchangeException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                lastError = e;
                if (retryPolicy.isLastAttempt(attempt)) {
                    break;
                }

                Duration delay = retryPolicy.delayFor(attempt);
                if (e instanceof RateLimitException rle && rle.getRetryAfterMs() > delay.toMillis()) {
                    delay = Duration.ofMillis(rle.getRetryAfterMs());
                }
                log.warn("{} {} fetch attempt {}/{} failed ({}), retrying in {} ms",
                    symbol, interval, attempt + 1, retryPolicy.maxAttempts(), e.getMessage(), delay.toMillis());
                sleeper.sleep(delay, token);
            }
        }

        log.error("{} {} fetch failed after {} attempts: {}",
            symbol, interval, retryPolicy.maxAttempts(), lastError.getMessage());
        throw lastError;
    }

    private void acquirePermit(CancellationToken token) throws FetchCancelledException {
        long wait = rateLimiter.reserve(token.remainingMillis());
        if (wait < 0) {
            token.throwIfCancelled();
            throw new FetchCancelledException("Rate limiter wait exceeds fetch deadline", true);
        }
        if (wait > 0) {
            token.sleep(Duration.ofMillis(wait));
        }
    }

    private static FetchWindow clip(FetchWindow window, long start, long end) {
        List<RawBar> rows = window.rows().stream()
            .filter(r -> r.timestamp() >= start && r.timestamp() < end)
            .toList();

        OptionalLong next = window.nextCursor();
        if (next.isPresent() && (next.getAsLong() >= end || next.getAsLong() <= start)) {
            next = OptionalLong.empty();
        }
        return new FetchWindow(rows, next);
    }
}
