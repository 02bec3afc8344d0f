package com.formwright.core.verify;

import com.formwright.config.FormwrightProperties;
import com.formwright.surface.ActionResult;
import com.formwright.surface.ObservedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Runs prove / act / re-prove cycles.
 * <p>
 * Every structural or state-changing action in the engine goes through {@link #run(Verification)}.
 * The expectation is re-evaluated from scratch on each poll, so a target that re-rendered
 * mid-wait is simply resolved again. Anything an expectation, precondition or guard throws
 * counts as "not proven"; anything an action throws counts as a failed action.
 */
@Component
public class VerificationProtocol {

    private static final Logger log = LoggerFactory.getLogger(VerificationProtocol.class);

    private final PollingClock clock;
    private final Duration pollInterval;
    private final Duration defaultTimeout;

    @Autowired
    public VerificationProtocol(PollingClock clock, FormwrightProperties properties) {
        this(clock, properties.getVerification().getPollInterval(),
                properties.getVerification().getDefaultTimeout());
    }

    public VerificationProtocol(PollingClock clock, Duration pollInterval, Duration defaultTimeout) {
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.defaultTimeout = defaultTimeout;
    }

    public PollingClock clock() {
        return clock;
    }

    public <T> Outcome<T> run(Verification<T> v) {
        var attempts = new ArrayList<Attempt>();
        int actions = 0;
        int totalPolls = 0;
        String detail = "";

        // 1. prove
        if (v.precondition() != null && holds(v.precondition(), v.name())) {
            Optional<T> value = evaluate(v.expectation(), v.name());
            totalPolls++;
            if (value.isPresent()) {
                log.debug("{}: precondition already holds, no action needed", v.name());
                attempts.add(new Attempt(v.name(), idOf(value.get()), Attempt.Result.CONFIRMED, 0, 1));
                return new Outcome<>(Outcome.Status.CONFIRMED, value.get(), 0, totalPolls, attempts, "");
            }
        }

        Duration timeout = v.timeout() != null ? v.timeout() : defaultTimeout;
        for (int attempt = 1; attempt <= v.maxAttempts(); attempt++) {
            if (v.guard() != null && !holds(v.guard(), v.name())) {
                log.warn("{}: guard does not hold, action refused (attempt {})", v.name(), attempt);
                attempts.add(new Attempt(v.name(), Attempt.PENDING, Attempt.Result.FAILED, attempt, 0));
                return new Outcome<>(Outcome.Status.REFUSED, null, actions, totalPolls, attempts, "guard");
            }

            // 2. act, exactly once per attempt
            ActionResult result = act(v);
            actions++;
            if (!result.performed()) {
                detail = result.detail();
                log.debug("{}: action not performed on attempt {}: {}", v.name(), attempt, detail);
            }

            // 3. re-prove
            long deadline = clock.nowMillis() + timeout.toMillis();
            int polls = 0;
            while (true) {
                Optional<T> value = evaluate(v.expectation(), v.name());
                polls++;
                if (value.isPresent()) {
                    totalPolls += polls;
                    attempts.add(new Attempt(v.name(), idOf(value.get()), Attempt.Result.CONFIRMED, attempt, polls));
                    log.debug("{}: confirmed on attempt {} after {} polls", v.name(), attempt, polls);
                    return new Outcome<>(Outcome.Status.CONFIRMED, value.get(), actions, totalPolls, attempts, detail);
                }
                long remaining = deadline - clock.nowMillis();
                if (remaining <= 0) {
                    break;
                }
                clock.sleep(Duration.ofMillis(Math.min(pollInterval.toMillis(), remaining)));
            }
            totalPolls += polls;

            // 4. timeout
            if (v.policy() == FailurePolicy.AMBIGUOUS) {
                attempts.add(new Attempt(v.name(), Attempt.PENDING, Attempt.Result.PHANTOM, attempt, polls));
                log.debug("{}: not proven within {}ms, reporting ambiguous", v.name(), timeout.toMillis());
                return new Outcome<>(Outcome.Status.AMBIGUOUS, null, actions, totalPolls, attempts, detail);
            }
            attempts.add(new Attempt(v.name(), Attempt.PENDING, Attempt.Result.FAILED, attempt, polls));
            log.debug("{}: not proven within {}ms on attempt {}/{}", v.name(), timeout.toMillis(),
                    attempt, v.maxAttempts());
        }
        return new Outcome<>(Outcome.Status.EXHAUSTED, null, actions, totalPolls, attempts, detail);
    }

    private ActionResult act(Verification<?> v) {
        try {
            var result = v.action().get();
            return result != null ? result : ActionResult.failed("no result");
        } catch (RuntimeException e) {
            log.debug("{}: action threw {}", v.name(), e.toString());
            return ActionResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static boolean holds(BooleanSupplier condition, String name) {
        try {
            return condition.getAsBoolean();
        } catch (RuntimeException e) {
            log.debug("{}: condition threw {}, treating as not holding", name, e.toString());
            return false;
        }
    }

    private static <T> Optional<T> evaluate(Expectation<T> expectation, String name) {
        try {
            Optional<T> value = expectation.check();
            return value != null ? value : Optional.empty();
        } catch (RuntimeException e) {
            log.debug("{}: expectation threw {}, treating as not proven", name, e.toString());
            return Optional.empty();
        }
    }

    private static String idOf(Object value) {
        if (value instanceof ObservedEntity entity) {
            return entity.id();
        }
        return value instanceof String s ? s : Attempt.PENDING;
    }
}
