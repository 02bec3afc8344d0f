package com.formwright.core.phantom;

import java.util.Set;

/**
 * The add-field attempt a phantom resolution is about.
 *
 * @param sectionId       section the field was dropped into
 * @param typeKey         requested field type, used to filter candidates when the surface reports types
 * @param expectedOrdinal position the new field should occupy within the section
 * @param knownBefore     field ids the section held before the attempt
 */
public record AddRequest(String sectionId, String typeKey, int expectedOrdinal, Set<String> knownBefore) {

    public AddRequest {
        knownBefore = Set.copyOf(knownBefore);
    }
}
