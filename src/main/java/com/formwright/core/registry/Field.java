package com.formwright.core.registry;

/**
 * A confirmed field.
 *
 * @param id        surface identifier
 * @param typeKey   opaque type discriminator
 * @param sectionId owning section (a back-reference, not ownership)
 * @param ordinal   position within the section
 * @param createdAt registry revision at which the field was confirmed
 * @param bound     whether the properties panel was last proven bound to this field
 */
public record Field(
    String id,
    String typeKey,
    String sectionId,
    int ordinal,
    long createdAt,
    boolean bound
) {

    /** A field about to be registered; the registry stamps {@code createdAt}. */
    public static Field confirmed(String id, String typeKey, String sectionId, int ordinal) {
        return new Field(id, typeKey, sectionId, ordinal, -1L, false);
    }

    Field withOrdinal(int newOrdinal) {
        return new Field(id, typeKey, sectionId, newOrdinal, createdAt, bound);
    }

    Field withCreatedAt(long sequence) {
        return new Field(id, typeKey, sectionId, ordinal, sequence, bound);
    }

    Field withBound(boolean value) {
        return new Field(id, typeKey, sectionId, ordinal, createdAt, value);
    }
}
