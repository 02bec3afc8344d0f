package com.formwright.surface;

/**
 * Single best-effort mutating actions against the surface.
 * <p>
 * Implementations report failure through {@link ActionResult}; they do not throw for
 * ordinary surface failures (missing element, intercepted click, rejected drop).
 */
public interface UiActions {

    ActionResult click(TargetRef target);

    ActionResult drag(TargetRef source, TargetRef destination);

    ActionResult select(TargetRef target);

    ActionResult setValue(TargetRef target, String property, String value);

    /** Reloads the current page. Used only by hard resynchronization. */
    ActionResult refresh();
}
