package org.errers.engine.pattern;

/**
 * Thrown from inside a running match when its deadline passed or the run was cancelled.
 */
public final class MatchTimeoutException extends RuntimeException {
    private final boolean cancelled;

    public MatchTimeoutException(boolean cancelled) {
        super(cancelled ? "Matching cancelled" : "Matching exceeded its deadline", null, false, false);
        this.cancelled = cancelled;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
