package com.formwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A parsed activity specification: the unit one build produces.
 *
 * @param code     activity code used to locate existing templates
 * @param title    activity title
 * @param type     activity type label (e.g. {@code written_assessment}), informational only
 * @param sections sections in specification order
 * @param source   where the specification was read from, may be {@code null}
 */
public record ActivitySpec(
    String code,
    String title,
    String type,
    List<SectionSpec> sections,
    String source
) implements Serializable {

    public ActivitySpec {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("activity code must not be blank");
        }
        title = title == null || title.isBlank() ? code : title;
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public ActivitySpec(String code, String title, List<SectionSpec> sections) {
        this(code, title, null, sections, null);
    }

    public int fieldCount() {
        return sections.stream().mapToInt(s -> s.fields().size()).sum();
    }
}
