package com.formwright.core.model;

/**
 * Machine-readable reasons attached to every skip, failure and abort.
 */
public final class Reasons {

    private Reasons() {}

    public static final String ALREADY_EXISTS = "already_exists";
    public static final String LOCKED_REQUIRES_REVISION = "locked_requires_revision";
    public static final String SHELL_CREATE_FAILED = "shell_create_failed";
    public static final String BUILDER_OPEN_FAILED = "builder_open_failed";
    public static final String SECTION_CREATE_FAILED = "section_create_failed";
    public static final String ALIGNMENT_EXHAUSTED = "alignment_exhausted";
    public static final String ADD_UNRECOVERABLE = "add_unrecoverable";
    public static final String AMBIGUOUS_CANDIDATES = "ambiguous_candidates";
    public static final String FIELD_ABSENT_AFTER_RESYNC = "field_absent_after_resync";
    public static final String HARD_RESYNC_BUDGET_EXHAUSTED = "hard_resync_budget_exhausted";
    public static final String HARD_RESYNC_FAILED = "hard_resync_failed";
    public static final String BINDING_UNPROVEN = "binding_unproven";
    public static final String CONFIGURE_FAILED = "configure_failed";
    public static final String CONSECUTIVE_FAILURES = "consecutive_failures";
    public static final String UNEXPECTED_ERROR = "unexpected_error";
}
