package com.formwright.surface.rehearsal;

/**
 * What the rehearsal surface does with one toolbox drag.
 */
public enum DropBehavior {
    /** The field renders immediately. */
    NORMAL,
    /** The field renders after the configured lag delay. */
    LAGGED,
    /** The drag is accepted and nothing happens. */
    SILENT,
    /** Two fields render immediately. */
    DOUBLE,
    /** Two fields render after the lag delay. */
    LAGGED_DOUBLE
}
