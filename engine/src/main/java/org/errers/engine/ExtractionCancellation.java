package org.errers.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token for a running extraction. May be cancelled from any thread.
 */
public final class ExtractionCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
