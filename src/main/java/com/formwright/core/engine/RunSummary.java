package com.formwright.core.engine;

import com.formwright.core.model.ActivityStatus;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a whole run, one entry per specification in the order given.
 */
public record RunSummary(String runId, Instant startedAt, List<ActivityOutcome> activities) {

    public RunSummary {
        activities = List.copyOf(activities);
    }

    public long count(ActivityStatus status) {
        return activities.stream().filter(a -> a.status() == status).count();
    }

    public boolean anyFailed() {
        return count(ActivityStatus.FAILED) > 0;
    }

    /** 0 when every activity completed or was skipped, 1 when any failed. */
    public int exitCode() {
        return anyFailed() ? 1 : 0;
    }
}
