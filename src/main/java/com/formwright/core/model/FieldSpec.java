package com.formwright.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One field to place inside a section.
 *
 * @param key        spec-local key used in logs and failure records
 * @param typeKey    opaque type discriminator, passed through to the surface and the configurator
 * @param title      optional title
 * @param ordinal    position among the section's fields in the specification
 * @param properties requested configuration, interpreted only by the configurator
 */
public record FieldSpec(
    String key,
    String typeKey,
    String title,
    int ordinal,
    Map<String, String> properties
) implements Serializable {

    public FieldSpec {
        if (typeKey == null || typeKey.isBlank()) {
            throw new IllegalArgumentException("typeKey must not be blank");
        }
        key = key == null || key.isBlank() ? typeKey + "-" + ordinal : key;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public FieldSpec(String typeKey, int ordinal) {
        this(null, typeKey, null, ordinal, Map.of());
    }
}
