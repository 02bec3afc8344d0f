package com.formwright.core.registry;

/**
 * A confirmed section.
 *
 * @param id      surface identifier
 * @param title   section title, {@code null} until known
 * @param ordinal position among sibling sections
 * @param aligned whether the canvas was last confirmed to display this section
 */
public record Section(String id, String title, int ordinal, boolean aligned) {

    public Section(String id, String title, int ordinal) {
        this(id, title, ordinal, false);
    }

    Section withOrdinal(int newOrdinal) {
        return new Section(id, title, newOrdinal, aligned);
    }

    Section withAligned(boolean value) {
        return new Section(id, title, ordinal, value);
    }

    Section withTitle(String newTitle) {
        return new Section(id, newTitle, ordinal, aligned);
    }
}
