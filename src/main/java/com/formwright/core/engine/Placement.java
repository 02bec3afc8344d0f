package com.formwright.core.engine;

/**
 * Where a new field is dropped within its section.
 *
 * @param afterFieldId confirmed field the new one goes directly after; {@code null} with
 *                     {@code atEnd=false} means the top of the section
 * @param atEnd        drop at the bottom of the section
 */
public record Placement(String afterFieldId, boolean atEnd) {

    public static Placement append() {
        return new Placement(null, true);
    }

    public static Placement top() {
        return new Placement(null, false);
    }

    public static Placement after(String fieldId) {
        return new Placement(fieldId, false);
    }
}
