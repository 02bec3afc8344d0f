package com.formwright.core.engine;

import com.formwright.core.events.BuildEvent;
import com.formwright.core.events.EventBus;
import com.formwright.core.model.FailureRecord;
import com.formwright.core.registry.EntityRegistry;
import com.formwright.core.verify.Outcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Everything one activity build owns: its registry, counters, alignment memory and
 * skipped-field records. Created when the activity starts, closed when it ends, and
 * never shared between activities.
 */
public class BuildContext implements AutoCloseable {

    private final String runId;
    private final String activityCode;
    private final EntityRegistry registry = new EntityRegistry();
    private final EventBus eventBus;
    private final int hardResyncBudget;
    private final long startedAtMillis;

    private final Map<String, Integer> counters = new LinkedHashMap<>();
    private final List<FailureRecord> failures = new ArrayList<>();
    private final Map<Integer, String> confirmedFieldIds = new HashMap<>();
    private long ticks;

    private String alignedSectionId;
    private long alignedAtMillis;

    private boolean closed;

    public BuildContext(String runId, String activityCode, EventBus eventBus,
                        int hardResyncBudget, long startedAtMillis) {
        this.runId = runId;
        this.activityCode = activityCode;
        this.eventBus = eventBus;
        this.hardResyncBudget = hardResyncBudget;
        this.startedAtMillis = startedAtMillis;
        for (String name : BuildCounters.ALL) {
            counters.put(name, 0);
        }
    }

    public String runId() { return runId; }
    public String activityCode() { return activityCode; }
    public long startedAtMillis() { return startedAtMillis; }

    public EntityRegistry registry() {
        ensureOpen();
        return registry;
    }

    // -- counters --

    public void increment(String counter) {
        add(counter, 1);
    }

    public void add(String counter, int delta) {
        ensureOpen();
        counters.merge(counter, delta, Integer::sum);
    }

    public int count(String counter) {
        return counters.getOrDefault(counter, 0);
    }

    public Map<String, Integer> counters() {
        return Collections.unmodifiableMap(counters);
    }

    /**
     * Charges a finished verification to the activity: its actions to the action counter
     * and its actions plus polls to logical elapsed time.
     */
    public <T> Outcome<T> account(Outcome<T> outcome) {
        add(BuildCounters.ACTIONS, outcome.actions());
        ticks += outcome.actions() + outcome.polls();
        return outcome;
    }

    /** Logical elapsed time: surface actions plus expectation checks. */
    public long ticks() {
        return ticks;
    }

    // -- hard resync budget --

    public int hardResyncsRemaining() {
        return Math.max(0, hardResyncBudget - count(BuildCounters.HARD_RESYNCS));
    }

    // -- alignment memory --

    public Optional<String> alignedSectionId() {
        return Optional.ofNullable(alignedSectionId);
    }

    public long alignedAtMillis() {
        return alignedAtMillis;
    }

    public void recordAlignment(String sectionId, long atMillis) {
        ensureOpen();
        this.alignedSectionId = sectionId;
        this.alignedAtMillis = atMillis;
        registry.markAligned(sectionId);
    }

    /** Forgets the last confirmed alignment after a mutation that can change what the canvas shows. */
    public void invalidateAlignment() {
        ensureOpen();
        this.alignedSectionId = null;
        registry.markAligned(null);
    }

    // -- confirmed fields by spec position --

    public void recordConfirmedField(int fieldIndex, String fieldId) {
        ensureOpen();
        confirmedFieldIds.put(fieldIndex, fieldId);
    }

    public Optional<String> confirmedFieldId(int fieldIndex) {
        return Optional.ofNullable(confirmedFieldIds.get(fieldIndex));
    }

    // -- failures --

    public void recordFailure(FailureRecord failure) {
        ensureOpen();
        failures.add(failure);
    }

    public List<FailureRecord> failures() {
        return List.copyOf(failures);
    }

    /** Removes and returns the failures a retry pass is about to attempt again. */
    public List<FailureRecord> drainFailures(Predicate<FailureRecord> filter) {
        ensureOpen();
        var drained = new ArrayList<FailureRecord>();
        failures.removeIf(f -> {
            if (filter.test(f)) {
                drained.add(f);
                return true;
            }
            return false;
        });
        return drained;
    }

    // -- events --

    public void emit(String eventType, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new BuildEvent(eventType, runId, activityCode, payload, Instant.now()));
        }
    }

    // -- lifecycle --

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new BuildContextClosedException(activityCode);
        }
    }
}
