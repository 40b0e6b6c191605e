package com.candlegate.ingest.fetch;

import com.candlegate.ingest.exchange.exception.FetchCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal with an optional deadline.
 *
 * Waits performed through {@link #sleep(Duration)} wake up as soon as the token
 * (or any ancestor) is cancelled. Cancelling a token cancels every child derived from it.
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CancellationToken parent;
    private final long deadlineMillis;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private CancellationToken(CancellationToken parent, long deadlineMillis) {
        this.parent = parent;
        this.deadlineMillis = deadlineMillis;
    }

    /**
     * Token without deadline, cancelled only explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, NO_DEADLINE);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(null, deadlineAfter(timeout));
    }

    /**
     * Child token that is cancelled with this one and may carry a tighter deadline.
     *
     * @param timeout child deadline relative to now, or null to inherit this token's deadline
     */
    public CancellationToken child(Duration timeout) {
        long deadline = timeout == null ? deadlineMillis : Math.min(deadlineMillis, deadlineAfter(timeout));
        CancellationToken child = new CancellationToken(this, deadline);
        children.add(child);
        if (isCancelledExplicitly()) {
            child.cancel();
        }
        return child;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            synchronized (lock) {
                lock.notifyAll();
            }
            for (CancellationToken child : children) {
                child.cancel();
            }
        }
    }

    public boolean isCancelled() {
        return isCancelledExplicitly() || isDeadlineExceeded();
    }

    public boolean isDeadlineExceeded() {
        return deadlineMillis != NO_DEADLINE && System.currentTimeMillis() >= deadlineMillis;
    }

    /**
     * Milliseconds until the deadline, {@link Long#MAX_VALUE} when there is none.
     */
    public long remainingMillis() {
        if (deadlineMillis == NO_DEADLINE) return Long.MAX_VALUE;
        return Math.max(0, deadlineMillis - System.currentTimeMillis());
    }

    public void throwIfCancelled() throws FetchCancelledException {
        if (isCancelledExplicitly()) {
            throw new FetchCancelledException("Fetch cancelled", false);
        }
        if (isDeadlineExceeded()) {
            throw new FetchCancelledException("Fetch deadline exceeded", true);
        }
    }

    /**
     * Sleep for the given duration unless cancelled or the deadline passes first.
     *
     * @throws FetchCancelledException if the wait was cut short
     */
    public void sleep(Duration duration) throws FetchCancelledException {
        long wakeAt = System.currentTimeMillis() + duration.toMillis();
        synchronized (lock) {
            while (true) {
                throwIfCancelled();
                long remaining = wakeAt - System.currentTimeMillis();
                if (remaining <= 0) {
                    return;
                }
                long wait = Math.min(remaining, remainingMillis());
                if (wait <= 0) {
                    continue; // deadline reached, next check throws
                }
                try {
                    lock.wait(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchCancelledException("Interrupted while waiting", false);
                }
            }
        }
    }

    private boolean isCancelledExplicitly() {
        return cancelled.get() || (parent != null && parent.isCancelledExplicitly());
    }

    private static long deadlineAfter(Duration timeout) {
        long now = System.currentTimeMillis();
        long millis = timeout.toMillis();
        return millis >= NO_DEADLINE - now ? NO_DEADLINE : now + millis;
    }
}
