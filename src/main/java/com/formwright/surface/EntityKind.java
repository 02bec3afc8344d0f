package com.formwright.surface;

/**
 * Kinds of structural entity the builder canvas exposes.
 */
public enum EntityKind {
    SECTION,
    FIELD
}
