package com.formwright.core.metrics;

import com.formwright.core.engine.ActivityOutcome;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.engine.BuildSummarySink;
import com.formwright.core.model.ActivityStatus;
import com.formwright.core.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Formwright builds. Registered as a summary sink,
 * so every finished activity is recorded.
 */
@Service
public class FormwrightMetrics implements BuildSummarySink {

    private final MeterRegistry registry;

    public FormwrightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void activityFinished(String runId, ActivityOutcome outcome) {
        recordActivityResult(outcome.status());
        recordActivityDuration(outcome.elapsedMillis());
        recordActivityTicks(outcome.ticks());

        recordPhantoms("late_candidate", outcome.counter(BuildCounters.LATE_CANDIDATES));
        recordPhantoms("recovered_resync", outcome.counter(BuildCounters.PHANTOMS_RESYNCED));
        recordPhantoms("unrecoverable", outcome.counter(BuildCounters.PHANTOMS_UNRECOVERABLE));
        recordHardResyncs(outcome.counter(BuildCounters.HARD_RESYNCS));
        for (var failure : outcome.failures()) {
            recordFieldFailure(failure.kind());
        }
    }

    public void recordActivityResult(ActivityStatus status) {
        Counter.builder("formwright.activities.total")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordActivityDuration(long ms) {
        Timer.builder("formwright.activity.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Logical elapsed time of an activity: surface actions plus expectation checks.
     */
    public void recordActivityTicks(long ticks) {
        DistributionSummary.builder("formwright.activity.ticks")
                .description("Surface actions plus expectation checks per activity")
                .register(registry)
                .record(ticks);
    }

    public void recordPhantoms(String resolution, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("formwright.phantoms.total")
                .description("Unconfirmed add-field actions, by how they were resolved")
                .tag("resolution", resolution)
                .register(registry)
                .increment(count);
    }

    public void recordHardResyncs(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("formwright.resyncs.total")
                .register(registry)
                .increment(count);
    }

    public void recordFieldFailure(FailureKind kind) {
        Counter.builder("formwright.fields.failed")
                .tag("kind", kind.name().toLowerCase())
                .register(registry)
                .increment();
    }
}
