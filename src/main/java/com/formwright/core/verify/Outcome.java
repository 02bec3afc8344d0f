package com.formwright.core.verify;

import java.util.List;
import java.util.Optional;

/**
 * Result of running a {@link Verification}.
 *
 * @param status   terminal status
 * @param value    what the expectation yielded, present only when confirmed
 * @param actions  mutating actions actually issued (zero on the fast path)
 * @param polls    expectation checks spent across all attempts
 * @param attempts per-cycle history
 * @param detail   free-form detail for logs (last action failure, refusal cause)
 * @param <T>      expectation value type
 */
public record Outcome<T>(
    Status status,
    T value,
    int actions,
    int polls,
    List<Attempt> attempts,
    String detail
) {

    public enum Status {
        CONFIRMED,
        /** Timed out under {@link FailurePolicy#AMBIGUOUS}: something may have happened. */
        AMBIGUOUS,
        /** Timed out on every attempt under {@link FailurePolicy#RETRY}. */
        EXHAUSTED,
        /** The guard did not hold, so no action was issued. */
        REFUSED
    }

    public Outcome {
        attempts = List.copyOf(attempts);
    }

    public boolean isConfirmed() {
        return status == Status.CONFIRMED;
    }

    public Optional<T> confirmedValue() {
        return isConfirmed() ? Optional.ofNullable(value) : Optional.empty();
    }

    /** True when the precondition already held and nothing was done. */
    public boolean wasFastPath() {
        return isConfirmed() && actions == 0;
    }
}
