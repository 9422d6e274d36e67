package com.seasonalesd.core.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe {@link CancellationToken} that another thread or a timer can
 * trip with {@link #cancel()}. Once set it stays set.
 *
 * @since 1.0.0
 */
public final class CancellationFlag implements CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Request cancellation. Idempotent. */
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationFlag{cancelled=" + cancelled.get() + '}';
    }
}
