package com.example.archivediff;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settable cancellation signal, raised from the shutdown hook on Ctrl+C.
 */
public final class CancellationFlag implements CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
