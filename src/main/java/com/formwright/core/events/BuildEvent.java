package com.formwright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run builds its activities, used by the CLI watch mode.
 *
 * @param eventType    event type (e.g. "activity.started", "field.recovered", "resync.hard")
 * @param runId        the run this event belongs to
 * @param activityCode the activity this event relates to (nullable for run-level events)
 * @param payload      arbitrary key-value data associated with the event
 * @param timestamp    when the event occurred
 */
public record BuildEvent(
    String eventType,
    String runId,
    String activityCode,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
