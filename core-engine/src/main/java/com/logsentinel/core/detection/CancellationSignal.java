package com.logsentinel.core.detection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the tasks of one scan.
 *
 * <p>
 * Not an error: scanners poll it at line-batch and file boundaries and stop
 * early, returning whatever they collected.
 * </p>
 *
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Request cancellation.
     *
     * @return {@code true} if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + '}';
    }
}
