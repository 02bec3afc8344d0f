package com.formwright.core.registry;

import com.formwright.surface.ObservedEntity;

import java.util.List;

/**
 * Difference between the registry's belief and an observation.
 *
 * @param newEntities observed but unknown: candidates for confirmation
 * @param missing     known but not observed: drift
 * @param reordered   known and observed, but in a different relative order
 */
public record RegistryDiff(
    List<ObservedEntity> newEntities,
    List<String> missing,
    List<String> reordered
) {

    public RegistryDiff {
        newEntities = List.copyOf(newEntities);
        missing = List.copyOf(missing);
        reordered = List.copyOf(reordered);
    }

    public boolean isClean() {
        return newEntities.isEmpty() && missing.isEmpty() && reordered.isEmpty();
    }

    public boolean hasDrift() {
        return !missing.isEmpty();
    }
}
