package org.errers.engine.rule;

import java.util.Objects;
import org.errers.engine.source.SourceLocation;

/**
 * What happened when a rule was applied to the buffer once (including its iterations).
 */
public final class RuleOutcome {

    public enum Status {
        APPLIED,
        /** The time budget ran out; changes of the interrupted application were discarded. */
        TIMED_OUT,
        /** The iteration cap of an iterative rule was reached. */
        ITERATION_LIMIT,
        /** A replacement threw; changes of the failing application were discarded. */
        FAILED
    }

    private final Status status;
    private final int matches;
    private final boolean changed;
    private final long elapsedNanos;
    private final RuntimeException failure;
    private final SourceLocation failureLocation;

    private RuleOutcome(
            Status status,
            int matches,
            boolean changed,
            long elapsedNanos,
            RuntimeException failure,
            SourceLocation failureLocation) {
        this.status = Objects.requireNonNull(status, "status");
        this.matches = matches;
        this.changed = changed;
        this.elapsedNanos = elapsedNanos;
        this.failure = failure;
        this.failureLocation = failureLocation;
    }

    public static RuleOutcome applied(int matches, boolean changed, long elapsedNanos) {
        return new RuleOutcome(Status.APPLIED, matches, changed, elapsedNanos, null, null);
    }

    public static RuleOutcome timedOut(int matches, boolean changed, long elapsedNanos) {
        return new RuleOutcome(Status.TIMED_OUT, matches, changed, elapsedNanos, null, null);
    }

    public static RuleOutcome iterationLimit(int matches, long elapsedNanos) {
        return new RuleOutcome(Status.ITERATION_LIMIT, matches, true, elapsedNanos, null, null);
    }

    public static RuleOutcome failed(
            int matches, boolean changed, long elapsedNanos, RuntimeException failure, SourceLocation location) {
        return new RuleOutcome(Status.FAILED, matches, changed, elapsedNanos, failure, location);
    }

    public Status getStatus() {
        return status;
    }

    public int getMatches() {
        return matches;
    }

    /** Whether the buffer differs from before the application. */
    public boolean isChanged() {
        return changed;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public RuntimeException getFailure() {
        return failure;
    }

    /** Document location of the match whose replacement failed. */
    public SourceLocation getFailureLocation() {
        return failureLocation;
    }
}
