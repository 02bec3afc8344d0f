package com.formwright.core.verify;

import com.formwright.support.ManualPollingClock;
import com.formwright.surface.ActionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VerificationProtocolTest {

    private ManualPollingClock clock;
    private VerificationProtocol protocol;
    private AtomicInteger actions;

    @BeforeEach
    void setUp() {
        clock = new ManualPollingClock();
        protocol = new VerificationProtocol(clock, Duration.ofMillis(100), Duration.ofSeconds(1));
        actions = new AtomicInteger();
    }

    private ActionResult act() {
        actions.incrementAndGet();
        return ActionResult.ok();
    }

    @Test
    @DisplayName("precondition already holding confirms without acting")
    void fastPathSkipsAction() {
        var outcome = protocol.run(Verification.named("noop")
                .precondition(() -> true)
                .action(this::act)
                .expectation(() -> Optional.of("done"))
                .build());

        assertTrue(outcome.isConfirmed());
        assertTrue(outcome.wasFastPath());
        assertEquals(0, actions.get());
        assertEquals("done", outcome.value());
    }

    @Test
    @DisplayName("acts once and confirms when the expectation appears during polling")
    void confirmsAfterPolling() {
        long start = clock.nowMillis();
        var outcome = protocol.run(Verification.named("appear")
                .action(this::act)
                .expectation(() -> clock.nowMillis() - start >= 300 ? Optional.of(1) : Optional.<Integer>empty())
                .build());

        assertTrue(outcome.isConfirmed());
        assertEquals(1, actions.get());
        assertEquals(1, outcome.actions());
        assertEquals(4, outcome.polls());
    }

    @Test
    @DisplayName("retry policy acts once per attempt then reports exhausted")
    void retryExhausts() {
        var outcome = protocol.run(Verification.named("never")
                .action(this::act)
                .expectation(Optional::<String>empty)
                .maxAttempts(3)
                .onTimeout(FailurePolicy.RETRY)
                .build());

        assertEquals(Outcome.Status.EXHAUSTED, outcome.status());
        assertEquals(3, actions.get());
        assertEquals(3, outcome.attempts().size());
        assertTrue(outcome.confirmedValue().isEmpty());
    }

    @Test
    @DisplayName("ambiguous policy never acts a second time")
    void ambiguousStopsAfterOneAction() {
        var outcome = protocol.run(Verification.named("drop")
                .action(this::act)
                .expectation(Optional::<String>empty)
                .maxAttempts(3)
                .onTimeout(FailurePolicy.AMBIGUOUS)
                .build());

        assertEquals(Outcome.Status.AMBIGUOUS, outcome.status());
        assertEquals(1, actions.get());
        assertEquals(Attempt.Result.PHANTOM, outcome.attempts().get(0).result());
    }

    @Test
    @DisplayName("failed guard refuses without acting")
    void guardRefuses() {
        var outcome = protocol.run(Verification.named("guarded")
                .guard(() -> false)
                .action(this::act)
                .expectation(() -> Optional.of("x"))
                .build());

        assertEquals(Outcome.Status.REFUSED, outcome.status());
        assertEquals(0, actions.get());
    }

    @Test
    @DisplayName("waits no longer than the timeout")
    void respectsTimeout() {
        long start = clock.nowMillis();
        protocol.run(Verification.named("slow")
                .action(this::act)
                .expectation(Optional::<String>empty)
                .timeout(Duration.ofMillis(450))
                .build());

        assertEquals(450, clock.nowMillis() - start);
    }

    @Test
    @DisplayName("throwing expectation counts as not proven")
    void throwingExpectationIsNotProven() {
        var flip = new AtomicBoolean();
        var outcome = protocol.run(Verification.named("flaky")
                .action(this::act)
                .expectation(() -> {
                    if (!flip.getAndSet(true)) {
                        throw new IllegalStateException("stale element");
                    }
                    return Optional.of("ok");
                })
                .build());

        assertTrue(outcome.isConfirmed());
        assertEquals(2, outcome.polls());
    }

    @Test
    @DisplayName("throwing action counts as a failed action and polling still happens")
    void throwingActionIsRecorded() {
        var outcome = protocol.run(Verification.named("boom")
                .action(() -> {
                    throw new IllegalStateException("detached");
                })
                .expectation(Optional::<String>empty)
                .timeout(Duration.ofMillis(200))
                .build());

        assertEquals(Outcome.Status.EXHAUSTED, outcome.status());
        assertTrue(outcome.detail().contains("detached"));
    }

    @Test
    @DisplayName("builder rejects a verification without action or expectation")
    void builderValidates() {
        assertThrows(IllegalStateException.class, () -> Verification.named("empty").build());
        assertThrows(IllegalArgumentException.class, () -> Verification.named("zero").maxAttempts(0));
    }
}
