package com.formwright.core.model;

/**
 * Terminal status of one activity build.
 */
public enum ActivityStatus {
    COMPLETED,
    SKIPPED,
    FAILED
}
