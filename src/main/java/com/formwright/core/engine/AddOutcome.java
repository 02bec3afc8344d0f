package com.formwright.core.engine;

import com.formwright.core.registry.Field;

/**
 * Result of {@link FieldAdder#add}.
 *
 * @param field     the confirmed and registered field, {@code null} when the add failed
 * @param recovered whether it was confirmed only through phantom recovery
 * @param reason    machine-readable reason when the add failed
 * @param retryable whether a later retry pass may try again
 * @param attempts  drag attempts spent
 */
public record AddOutcome(Field field, boolean recovered, String reason, boolean retryable, int attempts) {

    public boolean isAdded() {
        return field != null;
    }
}
