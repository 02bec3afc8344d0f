package com.formwright.core.verify;

import com.formwright.surface.ActionResult;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * A prove / act / re-prove cycle description, run by {@link VerificationProtocol}.
 * <p>
 * Build one per use with {@link #named(String)}; instances are immutable.
 *
 * @param <T> what the expectation yields
 */
public final class Verification<T> {

    private final String name;
    private final BooleanSupplier precondition;
    private final BooleanSupplier guard;
    private final Supplier<ActionResult> action;
    private final Expectation<T> expectation;
    private final Duration timeout;
    private final int maxAttempts;
    private final FailurePolicy policy;

    private Verification(Builder<T> b) {
        this.name = b.name;
        this.precondition = b.precondition;
        this.guard = b.guard;
        this.action = Objects.requireNonNull(b.action, "action");
        this.expectation = Objects.requireNonNull(b.expectation, "expectation");
        this.timeout = b.timeout;
        this.maxAttempts = b.maxAttempts;
        this.policy = b.policy;
    }

    public static Builder<Object> named(String name) {
        return new Builder<>(name);
    }

    public String name() { return name; }
    public BooleanSupplier precondition() { return precondition; }
    public BooleanSupplier guard() { return guard; }
    public Supplier<ActionResult> action() { return action; }
    public Expectation<T> expectation() { return expectation; }
    public Duration timeout() { return timeout; }
    public int maxAttempts() { return maxAttempts; }
    public FailurePolicy policy() { return policy; }

    public static final class Builder<T> {
        private final String name;
        private BooleanSupplier precondition;
        private BooleanSupplier guard;
        private Supplier<ActionResult> action;
        private Expectation<T> expectation;
        private Duration timeout;
        private int maxAttempts = 1;
        private FailurePolicy policy = FailurePolicy.RETRY;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * State that, when it already holds, makes the action unnecessary. The expectation
         * is still checked once before the verification is reported confirmed.
         */
        public Builder<T> precondition(BooleanSupplier precondition) {
            this.precondition = precondition;
            return this;
        }

        /** Checked before every action; when it does not hold the action is never issued. */
        public Builder<T> guard(BooleanSupplier guard) {
            this.guard = guard;
            return this;
        }

        public Builder<T> action(Supplier<ActionResult> action) {
            this.action = action;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <R> Builder<R> expectation(Expectation<R> expectation) {
            var self = (Builder<R>) (Builder<?>) this;
            self.expectation = expectation;
            return self;
        }

        public Builder<T> timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder<T> maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder<T> onTimeout(FailurePolicy policy) {
            this.policy = policy;
            return this;
        }

        public Verification<T> build() {
            if (action == null || expectation == null) {
                throw new IllegalStateException(name + ": action and expectation are required");
            }
            return new Verification<>(this);
        }
    }
}
