package com.example.archivediff;

import java.util.concurrent.CancellationException;

public interface CancellationSignal {
    /**
     * Returns true once the run has been asked to stop.
     */
    boolean isCancelled();

    /**
     * Throws {@link CancellationException} if the run has been asked to stop.
     */
    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Comparison cancelled.");
        }
    }

    /**
     * Default signal used when nothing can cancel the run.
     */
    CancellationSignal NEVER = () -> false;
}
