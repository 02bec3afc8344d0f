package com.formwright.surface;

/**
 * What part of the surface an observation covers: a single section's fields,
 * or the whole canvas (all sections plus the fields of the displayed section).
 *
 * @param sectionId the section to observe, or {@code null} for the whole canvas
 */
public record ObservationScope(String sectionId) {

    private static final ObservationScope CANVAS = new ObservationScope(null);

    public static ObservationScope canvas() {
        return CANVAS;
    }

    public static ObservationScope section(String sectionId) {
        if (sectionId == null || sectionId.isBlank()) {
            throw new IllegalArgumentException("sectionId must not be blank");
        }
        return new ObservationScope(sectionId);
    }

    public boolean isCanvas() {
        return sectionId == null;
    }

    @Override
    public String toString() {
        return isCanvas() ? "canvas" : "section:" + sectionId;
    }
}
