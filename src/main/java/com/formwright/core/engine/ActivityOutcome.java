package com.formwright.core.engine;

import com.formwright.core.model.ActivityStatus;
import com.formwright.core.model.FailureRecord;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * End-of-activity record handed to every {@link BuildSummarySink}.
 *
 * @param code            activity code
 * @param title           activity title
 * @param status          terminal status
 * @param reason          machine-readable reason for {@code SKIPPED} and {@code FAILED}, else {@code null}
 * @param templateId      template built or found, when known
 * @param counters        named counters at close
 * @param ticks           logical elapsed time (surface actions plus expectation checks)
 * @param elapsedMillis   wall-clock duration, informational only
 * @param fieldsRequested fields the specification asked for
 * @param failures        fields still skipped at close
 * @param source          where the specification came from, may be {@code null}
 */
public record ActivityOutcome(
    String code,
    String title,
    ActivityStatus status,
    String reason,
    String templateId,
    Map<String, Integer> counters,
    long ticks,
    long elapsedMillis,
    int fieldsRequested,
    List<FailureRecord> failures,
    String source
) implements Serializable {

    public ActivityOutcome {
        counters = Map.copyOf(counters);
        failures = List.copyOf(failures);
    }

    public int counter(String name) {
        return counters.getOrDefault(name, 0);
    }
}
