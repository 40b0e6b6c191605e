package com.candlegate.ingest.fetch;

import com.candlegate.ingest.exchange.exception.FetchCancelledException;

import java.time.Duration;

/**
 * Backoff wait. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper CANCELLABLE = (duration, token) -> token.sleep(duration);

    void sleep(Duration duration, CancellationToken token) throws FetchCancelledException;
}
