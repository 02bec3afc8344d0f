package com.formwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A named section and its fields, in specification order.
 */
public record SectionSpec(
    String title,
    List<FieldSpec> fields
) implements Serializable {

    public SectionSpec {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("section title must not be blank");
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
