package com.formwright.surface;

/**
 * Result of one best-effort mutating action. Performing an action proves nothing
 * about its effect; callers still have to re-prove the expected state.
 *
 * @param performed whether the surface accepted the action at all
 * @param detail    adapter-supplied detail, used in logs when the action was not performed
 */
public record ActionResult(boolean performed, String detail) {

    private static final ActionResult OK = new ActionResult(true, "");

    public static ActionResult ok() {
        return OK;
    }

    public static ActionResult failed(String detail) {
        return new ActionResult(false, detail);
    }
}
