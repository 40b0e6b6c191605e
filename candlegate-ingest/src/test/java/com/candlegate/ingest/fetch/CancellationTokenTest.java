package com.candlegate.ingest.fetch;

import com.candlegate.ingest.exchange.exception.FetchCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("New token is live with no deadline")
    void live() throws Exception {
        CancellationToken token = CancellationToken.create();

        assertFalse(token.isCancelled());
        assertEquals(Long.MAX_VALUE, token.remainingMillis());
        token.throwIfCancelled();
    }

    @Test
    @DisplayName("Cancelling a parent cancels its children, not the other way round")
    void cascades() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child(null);
        CancellationToken sibling = parent.child(null);

        sibling.cancel();
        assertFalse(parent.isCancelled());
        assertFalse(child.isCancelled());

        parent.cancel();
        assertTrue(child.isCancelled());
    }

    @Test
    @DisplayName("Children of a cancelled token start cancelled")
    void lateChild() {
        CancellationToken parent = CancellationToken.create();
        parent.cancel();

        assertTrue(parent.child(Duration.ofMinutes(1)).isCancelled());
    }

    @Test
    @DisplayName("An elapsed deadline reports deadline exceeded")
    void deadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);

        assertTrue(token.isDeadlineExceeded());
        FetchCancelledException e = assertThrows(FetchCancelledException.class, token::throwIfCancelled);
        assertTrue(e.isDeadlineExceeded());
    }

    @Test
    @DisplayName("A child deadline never extends the parent's")
    void childDeadline() {
        CancellationToken parent = CancellationToken.withTimeout(Duration.ofSeconds(1));
        CancellationToken child = parent.child(Duration.ofHours(1));

        assertTrue(child.remainingMillis() <= 1_000);
    }

    @Test
    @Timeout(5)
    @DisplayName("sleep wakes up when the token is cancelled from another thread")
    void sleepWakesOnCancel() throws Exception {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<Void> sleeper = CompletableFuture.runAsync(() -> {
            try {
                token.sleep(Duration.ofMinutes(10));
            } catch (FetchCancelledException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        token.cancel();

        ExecutionException e = assertThrows(ExecutionException.class, () -> sleeper.get(4, TimeUnit.SECONDS));
        assertInstanceOf(FetchCancelledException.class, e.getCause().getCause());
    }

    @Test
    @Timeout(5)
    @DisplayName("sleep stops at the deadline")
    void sleepStopsAtDeadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(100));

        FetchCancelledException e = assertThrows(FetchCancelledException.class,
            () -> token.sleep(Duration.ofMinutes(10)));
        assertTrue(e.isDeadlineExceeded());
    }

    @Test
    @DisplayName("Short sleep on a live token returns normally")
    void shortSleep() throws Exception {
        CancellationToken.create().sleep(Duration.ofMillis(5));
    }
}
