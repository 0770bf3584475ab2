package org.errers.engine.pattern;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Character source for a matcher that aborts the match once a deadline passed or cancellation was requested.
 * The regex engine reads the input through {@link #charAt(int)}, so even a catastrophically backtracking
 * pattern is interrupted within a bounded number of reads.
 */
public final class DeadlineCharSequence implements CharSequence {
    private static final int CHECK_INTERVAL = 1024;

    private final CharSequence delegate;
    private final long deadlineNanos;
    private final BooleanSupplier cancelled;
    private int countdown = CHECK_INTERVAL;

    public DeadlineCharSequence(CharSequence delegate, long deadlineNanos, BooleanSupplier cancelled) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.deadlineNanos = deadlineNanos;
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
    }

    @Override
    public char charAt(int index) {
        if (--countdown <= 0) {
            countdown = CHECK_INTERVAL;
            if (cancelled.getAsBoolean()) {
                throw new MatchTimeoutException(true);
            }
            if (System.nanoTime() - deadlineNanos > 0) {
                throw new MatchTimeoutException(false);
            }
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return delegate.subSequence(start, end);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
