package com.formwright.core.alignment;

/**
 * Result of {@link SectionAlignmentGuard#ensureAligned}.
 *
 * @param aligned   whether the canvas is proven to show the section
 * @param path      how alignment was established (or last attempted)
 * @param reason    machine-readable reason when not aligned
 */
public record AlignmentResult(boolean aligned, Path path, String reason) {

    public enum Path {
        /** Trusted the last confirmed alignment; no surface interaction. */
        FAST,
        /** Selected the section (or found it already shown) and proved it by read-back. */
        SLOW,
        /** Needed a hard resync. */
        RESYNC
    }

    static AlignmentResult ok(Path path) {
        return new AlignmentResult(true, path, null);
    }

    static AlignmentResult failed(Path path, String reason) {
        return new AlignmentResult(false, path, reason);
    }
}
