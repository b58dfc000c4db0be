package com.example.styleverify.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one verification run, checked at every pair boundary.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
