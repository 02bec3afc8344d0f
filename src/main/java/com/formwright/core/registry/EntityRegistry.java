package com.formwright.core.registry;

import com.formwright.surface.EntityKind;
import com.formwright.surface.ObservedEntity;
import com.formwright.surface.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative record of the sections and fields confirmed during one activity build.
 * <p>
 * The registry only ever holds entities a verification cycle has confirmed. It is
 * mutated through {@link #register(Section)}, {@link #register(Field)} and
 * {@link #rebuildFromObservation(Snapshot)}; each of those bumps the revision exactly once.
 * The alignment and binding flags are bookkeeping and do not move the revision.
 * <p>
 * Not thread-safe: one registry belongs to one activity build on one control thread.
 */
public class EntityRegistry {

    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    private final Map<String, Section> sections = new LinkedHashMap<>();
    private final Map<String, List<Field>> fieldsBySection = new HashMap<>();
    private final Map<String, Field> fields = new HashMap<>();
    private long revision;

    public long revision() {
        return revision;
    }

    /**
     * Ids currently known for a kind. The returned set is a read-only live view.
     */
    public Set<String> knownIds(EntityKind kind) {
        return switch (kind) {
            case SECTION -> Collections.unmodifiableSet(sections.keySet());
            case FIELD -> Collections.unmodifiableSet(fields.keySet());
        };
    }

    public boolean isKnown(EntityKind kind, String id) {
        return knownIds(kind).contains(id);
    }

    /**
     * Registers a confirmed section at its ordinal, shifting later sections down.
     *
     * @throws DuplicateIdException if the id is already known
     */
    public Section register(Section section) {
        if (sections.containsKey(section.id())) {
            throw new DuplicateIdException(EntityKind.SECTION, section.id());
        }
        var ordered = new ArrayList<>(sections.values());
        int at = Math.max(0, Math.min(section.ordinal(), ordered.size()));
        ordered.add(at, section);
        sections.clear();
        for (int i = 0; i < ordered.size(); i++) {
            var s = ordered.get(i).withOrdinal(i);
            sections.put(s.id(), s);
        }
        fieldsBySection.putIfAbsent(section.id(), new ArrayList<>());
        revision++;
        log.debug("Registered section {} '{}' at {} (rev {})", section.id(), section.title(), at, revision);
        return sections.get(section.id());
    }

    /**
     * Registers a confirmed field at its ordinal within its section and stamps its
     * creation sequence with the new revision.
     *
     * @throws DuplicateIdException  if the id is already known
     * @throws IllegalStateException if the owning section is not registered
     */
    public Field register(Field field) {
        if (fields.containsKey(field.id())) {
            throw new DuplicateIdException(EntityKind.FIELD, field.id());
        }
        var list = fieldsBySection.get(field.sectionId());
        if (list == null || !sections.containsKey(field.sectionId())) {
            throw new IllegalStateException("Section " + field.sectionId()
                    + " is not registered; cannot register field " + field.id());
        }
        revision++;
        int at = Math.max(0, Math.min(field.ordinal(), list.size()));
        list.add(at, field.withCreatedAt(revision));
        renumber(list);
        log.debug("Registered field {} ({}) in section {} at {} (rev {})",
                field.id(), field.typeKey(), field.sectionId(), at, revision);
        return fields.get(field.id());
    }

    /**
     * Compares an observation against the registry within the observation's scope.
     * Pure: the registry is not modified.
     */
    public RegistryDiff diff(Snapshot observed) {
        var fresh = new ArrayList<ObservedEntity>();
        var missing = new ArrayList<String>();
        var reordered = new ArrayList<String>();

        if (observed.scope().isCanvas()) {
            var observedSections = observed.ofKind(EntityKind.SECTION);
            compare(sections.values().stream().map(Section::id).toList(),
                    observedSections, fresh, missing, reordered);
            var owners = new LinkedHashSet<String>();
            for (var e : observed.ofKind(EntityKind.FIELD)) {
                owners.add(e.sectionId());
            }
            for (var owner : owners) {
                compare(fieldIds(owner), observed.fieldsIn(owner), fresh, missing, reordered);
            }
        } else {
            String sectionId = observed.scope().sectionId();
            compare(fieldIds(sectionId), observed.fieldsIn(sectionId), fresh, missing, reordered);
        }
        return new RegistryDiff(fresh, missing, reordered);
    }

    /**
     * Replaces the registry's view of the observed scope with the observation.
     * <p>
     * Destructive: provisional flags (alignment, binding) inside the scope are discarded.
     * Known ids keep their creation sequence; ids seen for the first time are stamped
     * with the new revision. Only the recovery path calls this.
     */
    public void rebuildFromObservation(Snapshot observed) {
        revision++;
        if (observed.scope().isCanvas()) {
            var observedSections = sortByOrdinal(observed.ofKind(EntityKind.SECTION));
            var previous = new LinkedHashMap<>(sections);
            sections.clear();
            for (int i = 0; i < observedSections.size(); i++) {
                var e = observedSections.get(i);
                var prior = previous.get(e.id());
                String title = e.title() != null ? e.title() : prior != null ? prior.title() : null;
                sections.put(e.id(), new Section(e.id(), title, i));
            }
            for (var gone : previous.keySet()) {
                if (!sections.containsKey(gone)) {
                    dropSectionFields(gone);
                }
            }
            for (var id : sections.keySet()) {
                fieldsBySection.putIfAbsent(id, new ArrayList<>());
            }
            var owners = new LinkedHashSet<String>();
            for (var e : observed.ofKind(EntityKind.FIELD)) {
                owners.add(e.sectionId());
            }
            for (var owner : owners) {
                replaceSectionFields(owner, observed.fieldsIn(owner));
            }
        } else {
            String sectionId = observed.scope().sectionId();
            if (!sections.containsKey(sectionId)) {
                sections.put(sectionId, new Section(sectionId, null, sections.size()));
            }
            replaceSectionFields(sectionId, observed.fieldsIn(sectionId));
            var section = sections.get(sectionId);
            sections.put(sectionId, section.withAligned(false));
        }
        log.info("Registry rebuilt from {} observation: {} sections, {} fields (rev {})",
                observed.scope(), sections.size(), fields.size(), revision);
    }

    /** Marks the section the canvas was just confirmed to display. */
    public void markAligned(String sectionId) {
        for (var entry : sections.entrySet()) {
            var s = entry.getValue();
            boolean value = s.id().equals(sectionId);
            if (s.aligned() != value) {
                entry.setValue(s.withAligned(value));
            }
        }
    }

    /** Marks the field the properties panel was just proven bound to. */
    public void markBound(String fieldId) {
        for (var list : fieldsBySection.values()) {
            for (int i = 0; i < list.size(); i++) {
                var f = list.get(i);
                boolean value = f.id().equals(fieldId);
                if (f.bound() != value) {
                    var updated = f.withBound(value);
                    list.set(i, updated);
                    fields.put(updated.id(), updated);
                }
            }
        }
    }

    public Optional<Section> section(String id) {
        return Optional.ofNullable(sections.get(id));
    }

    public Optional<Field> field(String id) {
        return Optional.ofNullable(fields.get(id));
    }

    public List<Section> sections() {
        return List.copyOf(sections.values());
    }

    public List<Field> fields(String sectionId) {
        var list = fieldsBySection.get(sectionId);
        return list == null ? List.of() : List.copyOf(list);
    }

    public Optional<Section> findSectionByTitle(String title) {
        String wanted = normalizeTitle(title);
        return sections.values().stream()
                .filter(s -> s.title() != null && normalizeTitle(s.title()).equals(wanted))
                .findFirst();
    }

    /** Records a confirmed title change for a section. Bookkeeping only. */
    public void retitle(String sectionId, String title) {
        var s = sections.get(sectionId);
        if (s != null) {
            sections.put(sectionId, s.withTitle(title));
        }
    }

    public RegistrySnapshot snapshot() {
        var entries = new ArrayList<RegistrySnapshot.Entry>();
        for (var s : sections.values()) {
            entries.add(new RegistrySnapshot.Entry(s, fields(s.id())));
        }
        return new RegistrySnapshot(revision, entries);
    }

    static String normalizeTitle(String title) {
        if (title == null) return "";
        return String.join(" ", title.trim().split("\\s+")).toLowerCase(Locale.ROOT);
    }

    // -- internals --

    private List<String> fieldIds(String sectionId) {
        var list = fieldsBySection.get(sectionId);
        return list == null ? List.of() : list.stream().map(Field::id).toList();
    }

    private void compare(List<String> knownOrder, List<ObservedEntity> observed,
                         List<ObservedEntity> fresh, List<String> missing, List<String> reordered) {
        var known = new LinkedHashSet<>(knownOrder);
        var seen = new LinkedHashSet<String>();
        for (var e : observed) {
            seen.add(e.id());
            if (!known.contains(e.id())) {
                fresh.add(e);
            }
        }
        for (var id : knownOrder) {
            if (!seen.contains(id)) {
                missing.add(id);
            }
        }
        // Relative order of the ids both sides agree exist.
        var believed = knownOrder.stream().filter(seen::contains).toList();
        var actual = sortByOrdinal(observed).stream()
                .map(ObservedEntity::id)
                .filter(known::contains)
                .toList();
        for (int i = 0; i < believed.size(); i++) {
            if (!believed.get(i).equals(actual.get(i))) {
                reordered.add(believed.get(i));
            }
        }
    }

    private void replaceSectionFields(String sectionId, List<ObservedEntity> observedFields) {
        var previous = fieldsBySection.getOrDefault(sectionId, List.of());
        var priorById = new HashMap<String, Field>();
        for (var f : previous) {
            priorById.put(f.id(), f);
            fields.remove(f.id());
        }
        var rebuilt = new ArrayList<Field>();
        for (var e : sortByOrdinal(observedFields)) {
            var prior = priorById.get(e.id());
            // A field id can only live in one section; a stale entry elsewhere is dropped.
            var elsewhere = fields.remove(e.id());
            if (elsewhere != null) {
                fieldsBySection.get(elsewhere.sectionId()).removeIf(f -> f.id().equals(e.id()));
            }
            String typeKey = e.typeKey() != null ? e.typeKey() : prior != null ? prior.typeKey() : null;
            long createdAt = prior != null ? prior.createdAt() : revision;
            rebuilt.add(new Field(e.id(), typeKey, sectionId, rebuilt.size(), createdAt, false));
        }
        fieldsBySection.put(sectionId, rebuilt);
        for (var f : rebuilt) {
            fields.put(f.id(), f);
        }
    }

    private void dropSectionFields(String sectionId) {
        var list = fieldsBySection.remove(sectionId);
        if (list != null) {
            for (var f : list) {
                fields.remove(f.id());
            }
        }
    }

    private void renumber(List<Field> list) {
        for (int i = 0; i < list.size(); i++) {
            var f = list.get(i);
            if (f.ordinal() != i) {
                f = f.withOrdinal(i);
                list.set(i, f);
            }
            fields.put(f.id(), f);
        }
    }

    private static List<ObservedEntity> sortByOrdinal(List<ObservedEntity> entities) {
        return entities.stream()
                .sorted(Comparator.comparingInt(ObservedEntity::ordinal))
                .toList();
    }
}
