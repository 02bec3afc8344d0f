package com.formwright.surface;

/**
 * One entity as read directly from the rendered surface.
 *
 * @param id        identifier assigned by the surface
 * @param kind      section or field
 * @param ordinal   position among its siblings at observation time
 * @param sectionId owning section for fields, {@code null} for sections
 * @param typeKey   rendered field type when the surface exposes it, otherwise {@code null}
 * @param title     rendered title, may be {@code null}
 */
public record ObservedEntity(
    String id,
    EntityKind kind,
    int ordinal,
    String sectionId,
    String typeKey,
    String title
) {

    public static ObservedEntity section(String id, int ordinal, String title) {
        return new ObservedEntity(id, EntityKind.SECTION, ordinal, null, null, title);
    }

    public static ObservedEntity field(String id, String sectionId, int ordinal, String typeKey) {
        return new ObservedEntity(id, EntityKind.FIELD, ordinal, sectionId, typeKey, null);
    }
}
