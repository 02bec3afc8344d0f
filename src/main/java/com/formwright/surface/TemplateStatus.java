package com.formwright.surface;

/**
 * Listing an activity template can be found in.
 */
public enum TemplateStatus {
    ACTIVE,
    INACTIVE
}
