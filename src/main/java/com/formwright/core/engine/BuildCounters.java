package com.formwright.core.engine;

import java.util.List;

/**
 * Names of the per-activity counters carried by {@link BuildContext}.
 */
public final class BuildCounters {

    private BuildCounters() {}

    public static final String ACTIONS = "actions";
    public static final String TEMPLATE_LOOKUPS = "template_lookups";
    public static final String SECTIONS_CREATED = "sections_created";
    public static final String DRAG_ATTEMPTS = "drag_attempts";
    public static final String FIELDS_CONFIRMED = "fields_confirmed";
    public static final String PHANTOM_TIMEOUTS = "phantom_timeouts";
    public static final String LATE_CANDIDATES = "late_candidates";
    public static final String PHANTOMS_RESYNCED = "phantoms_resynced";
    public static final String PHANTOMS_UNRECOVERABLE = "phantoms_unrecoverable";
    public static final String HARD_RESYNCS = "hard_resyncs";
    public static final String ALIGNMENT_FAST_PATHS = "alignment_fast_paths";
    public static final String ALIGNMENT_SLOW_PATHS = "alignment_slow_paths";
    public static final String BINDING_REFUSALS = "binding_refusals";
    public static final String PROPERTY_WRITES = "property_writes";
    public static final String FIELDS_SKIPPED = "fields_skipped";
    public static final String RETRY_PASSES = "retry_passes";
    public static final String FIELDS_RETRIED = "fields_retried";

    static final List<String> ALL = List.of(
            ACTIONS, TEMPLATE_LOOKUPS, SECTIONS_CREATED, DRAG_ATTEMPTS, FIELDS_CONFIRMED,
            PHANTOM_TIMEOUTS, LATE_CANDIDATES, PHANTOMS_RESYNCED, PHANTOMS_UNRECOVERABLE, HARD_RESYNCS,
            ALIGNMENT_FAST_PATHS,
            ALIGNMENT_SLOW_PATHS, BINDING_REFUSALS, PROPERTY_WRITES, FIELDS_SKIPPED,
            RETRY_PASSES, FIELDS_RETRIED);
}
