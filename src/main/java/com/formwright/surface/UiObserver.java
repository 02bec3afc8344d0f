package com.formwright.surface;

/**
 * Reads what is actually rendered. Implementations must not answer from a cache.
 */
@FunctionalInterface
public interface UiObserver {

    Snapshot observe(ObservationScope scope);
}
