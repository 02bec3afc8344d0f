package com.formwright.core.engine;

import com.formwright.core.model.ActivitySpec;

import java.util.List;

/**
 * Receives structured records as a run progresses. A sink that throws is logged and ignored.
 */
public interface BuildSummarySink {

    default void runStarted(String runId, List<ActivitySpec> specs) {
    }

    void activityFinished(String runId, ActivityOutcome outcome);

    default void runFinished(RunSummary summary) {
    }
}
