package com.formwright.surface;

/**
 * A re-resolvable reference to something on the surface.
 * <p>
 * A reference names a target; it never holds a live element. Adapters resolve it
 * again on every use, so a re-render between two uses cannot leave a stale handle.
 *
 * @param type   what kind of target this is
 * @param key    identifying key within the type (section id, field id, type key), may be {@code null}
 * @param anchor secondary key, used by drop zones for the insert-after field id, may be {@code null}
 */
public record TargetRef(Type type, String key, String anchor) {

    public enum Type {
        SECTION_ITEM,
        CREATE_SECTION,
        CANVAS_ROOT,
        TOOLBOX_CARD,
        DROP_ZONE,
        FIELD,
        PROPERTIES_PANEL,
        BUILDER_ROOT,
        CREATE_ACTIVITY,
        TEMPLATE
    }

    public static TargetRef sectionItem(String sectionId) {
        return new TargetRef(Type.SECTION_ITEM, sectionId, null);
    }

    public static TargetRef createSection() {
        return new TargetRef(Type.CREATE_SECTION, null, null);
    }

    public static TargetRef canvasRoot() {
        return new TargetRef(Type.CANVAS_ROOT, null, null);
    }

    public static TargetRef toolboxCard(String typeKey) {
        return new TargetRef(Type.TOOLBOX_CARD, typeKey, null);
    }

    /** Drop zone at the bottom of a section. */
    public static TargetRef dropZone(String sectionId) {
        return new TargetRef(Type.DROP_ZONE, sectionId, null);
    }

    /** Drop zone directly after {@code afterFieldId}, or the section top when it is {@code null}. */
    public static TargetRef dropZoneAfter(String sectionId, String afterFieldId) {
        return new TargetRef(Type.DROP_ZONE, sectionId, afterFieldId == null ? "" : afterFieldId);
    }

    public static TargetRef field(String fieldId) {
        return new TargetRef(Type.FIELD, fieldId, null);
    }

    public static TargetRef propertiesPanel() {
        return new TargetRef(Type.PROPERTIES_PANEL, null, null);
    }

    public static TargetRef builderRoot() {
        return new TargetRef(Type.BUILDER_ROOT, null, null);
    }

    public static TargetRef createActivity() {
        return new TargetRef(Type.CREATE_ACTIVITY, null, null);
    }

    public static TargetRef template(String templateId) {
        return new TargetRef(Type.TEMPLATE, templateId, null);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(type.name().toLowerCase());
        if (key != null) sb.append('[').append(key).append(']');
        if (anchor != null) sb.append("@after[").append(anchor.isEmpty() ? "top" : anchor).append(']');
        return sb.toString();
    }
}
