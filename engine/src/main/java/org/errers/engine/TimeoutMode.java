package org.errers.engine;

/**
 * How the per-rule time budget is applied.
 */
public enum TimeoutMode {
    /** Matching is interrupted once the budget is spent; the rule's pending changes are discarded. */
    ENFORCED,
    /** Matching runs to completion; overruns are only reported. */
    ADVISORY
}
