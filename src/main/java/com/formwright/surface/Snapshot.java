package com.formwright.surface;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of entities currently rendered for a scope.
 * <p>
 * A snapshot is a point-in-time reading; it is never refreshed in place.
 */
public record Snapshot(ObservationScope scope, List<ObservedEntity> entities) {

    public Snapshot {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static Snapshot empty(ObservationScope scope) {
        return new Snapshot(scope, List.of());
    }

    public List<ObservedEntity> ofKind(EntityKind kind) {
        return entities.stream().filter(e -> e.kind() == kind).toList();
    }

    public List<ObservedEntity> fieldsIn(String sectionId) {
        return entities.stream()
                .filter(e -> e.kind() == EntityKind.FIELD && sectionId.equals(e.sectionId()))
                .toList();
    }

    public Set<String> ids(EntityKind kind) {
        var ids = new LinkedHashSet<String>();
        for (var e : entities) {
            if (e.kind() == kind) {
                ids.add(e.id());
            }
        }
        return ids;
    }

    public Optional<ObservedEntity> find(String id) {
        return entities.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public int size() {
        return entities.size();
    }
}
