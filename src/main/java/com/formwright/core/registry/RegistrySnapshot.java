package com.formwright.core.registry;

import java.util.List;

/**
 * Ordered, immutable copy of the registry at one revision.
 */
public record RegistrySnapshot(long revision, List<Entry> sections) {

    public RegistrySnapshot {
        sections = List.copyOf(sections);
    }

    public record Entry(Section section, List<Field> fields) {
        public Entry {
            fields = List.copyOf(fields);
        }
    }

    public int fieldCount() {
        return sections.stream().mapToInt(e -> e.fields().size()).sum();
    }
}
