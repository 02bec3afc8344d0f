package com.formwright.core.model;

/**
 * Which stage a skipped field failed in.
 */
public enum FailureKind {
    ALIGNMENT,
    ADD,
    BIND,
    CONFIGURE
}
