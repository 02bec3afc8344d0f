package com.formwright.core.phantom;

/**
 * States of one phantom add, from the moment its re-prove timed out.
 */
public enum PhantomState {
    IDLE,
    DROPPED,
    LATE_CANDIDATE_CHECK,
    HARD_RESYNC,
    RECOVERED,
    UNRECOVERABLE;

    public boolean isTerminal() {
        return this == RECOVERED || this == UNRECOVERABLE;
    }
}
