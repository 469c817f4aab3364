package com.partcompat.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Signals that the caller no longer wants the result of a running lookup,
 * for example because a newer keystroke superseded it.
 *
 * A cancelled lookup returns an empty result without logging an error.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Lookup cancelled");
        }
    }
}
