package com.formwright.core.verify;

/**
 * What a verification does when the re-prove step times out.
 */
public enum FailurePolicy {
    /** Act again, up to the attempt budget, then report {@link Outcome.Status#EXHAUSTED}. */
    RETRY,
    /** Stop after the first timeout and report {@link Outcome.Status#AMBIGUOUS}; the caller resolves it. */
    AMBIGUOUS
}
