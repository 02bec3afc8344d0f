package com.formwright.surface.rehearsal;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.verify.PollingClock;
import com.formwright.surface.ActionResult;
import com.formwright.surface.BuilderSurface;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.ObservedEntity;
import com.formwright.surface.Snapshot;
import com.formwright.surface.TargetRef;
import com.formwright.surface.TemplateMatch;
import com.formwright.surface.TemplateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * In-memory form builder that behaves like the real one on a bad day.
 * <p>
 * Faults are either scripted ({@link #scriptDrops}, {@link #misbindNext}, {@link #failShellFor},
 * {@link #stallBuilderFor}, {@link #crashListingsFor}, {@link #ignoreSectionCreates},
 * {@link #lagSectionCreates}, {@link #ignoreSectionTitles}) or drawn from a seeded random source using the
 * {@code formwright.surface.rehearsal.*} rates. Lag is measured on the shared
 * {@link PollingClock}, so a manual clock makes every fault deterministic.
 * <p>
 * A section's fields are only rendered while that section is displayed, as on the real canvas.
 */
public class RehearsalSurface implements BuilderSurface {

    private static final Logger log = LoggerFactory.getLogger(RehearsalSurface.class);

    static final String UNTITLED_SECTION = "Untitled section";

    private final FormwrightProperties.Rehearsal config;
    private final PollingClock clock;
    private final Random random;

    private final Map<String, Template> templates = new LinkedHashMap<>();
    private final Set<String> failingShells = new HashSet<>();
    private final Set<String> stalledBuilders = new HashSet<>();
    private final Set<String> crashingListings = new HashSet<>();
    private final Deque<DropBehavior> scriptedDrops = new ArrayDeque<>();
    private final List<PendingRender> pending = new ArrayList<>();
    private final List<PendingSection> pendingSections = new ArrayList<>();
    private final List<String> actionLog = new ArrayList<>();
    private int misbindsRemaining;
    private int ignoredSectionCreates;
    private int laggedSectionCreates;
    private int ignoredSectionTitles;
    private int sequence;

    private Template open;
    private String displayedSectionId;
    private String nextDisplayedSectionId;
    private int displayReadsRemaining;
    private String boundFieldId;

    public RehearsalSurface(FormwrightProperties.Rehearsal config, PollingClock clock) {
        this.config = config;
        this.clock = clock;
        this.random = new Random(config.getSeed());
    }

    // -- scripting --

    public synchronized TemplateMatch seedTemplate(String code, String title, TemplateStatus status, boolean locked) {
        var template = new Template(nextId("tpl"), code, title, status, locked);
        templates.put(template.id, template);
        return template.toMatch();
    }

    /** Shell submissions for this code are accepted and silently dropped. */
    public synchronized void failShellFor(String code) {
        failingShells.add(code);
    }

    /** Behaviours for the next drags, in order; later drags fall back to the configured rates. */
    public synchronized void scriptDrops(DropBehavior... behaviors) {
        Collections.addAll(scriptedDrops, behaviors);
    }

    /** The next {@code count} field clicks bind the properties panel to the wrong field. */
    public synchronized void misbindNext(int count) {
        misbindsRemaining += count;
    }

    /** Opening the builder for this code is accepted and leaves the previous page in place. */
    public synchronized void stallBuilderFor(String code) {
        stalledBuilders.add(code);
    }

    /** Searching the template listings for this code throws, as a crashed page would. */
    public synchronized void crashListingsFor(String code) {
        crashingListings.add(code);
    }

    /** The next {@code count} create-section clicks are accepted and do nothing. */
    public synchronized void ignoreSectionCreates(int count) {
        ignoredSectionCreates += count;
    }

    /** The next {@code count} created sections render only after the configured lag delay. */
    public synchronized void lagSectionCreates(int count) {
        laggedSectionCreates += count;
    }

    /** The next {@code count} section title writes are accepted and do nothing. */
    public synchronized void ignoreSectionTitles(int count) {
        ignoredSectionTitles += count;
    }

    // -- inspection --

    /** Every mutating action issued so far, as {@code verb target}. */
    public synchronized List<String> actionLog() {
        return List.copyOf(actionLog);
    }

    public synchronized int mutationCount() {
        return actionLog.size();
    }

    public synchronized Optional<TemplateMatch> template(String code) {
        return templates.values().stream().filter(t -> t.code.equals(code)).findFirst().map(Template::toMatch);
    }

    /** Section titles of a template, in canvas order, including fields still waiting to render. */
    public synchronized Map<String, List<String>> layout(String code) {
        var layout = new LinkedHashMap<String, List<String>>();
        templates.values().stream().filter(t -> t.code.equals(code)).findFirst().ifPresent(t -> {
            for (var s : t.sections) {
                layout.put(s.title, s.fields.stream().map(f -> f.typeKey).toList());
            }
        });
        return layout;
    }

    public synchronized Map<String, String> fieldProperties(String fieldId) {
        return findField(fieldId).map(f -> Map.copyOf(f.properties)).orElse(Map.of());
    }

    // -- UiObserver --

    @Override
    public synchronized Snapshot observe(ObservationScope scope) {
        renderDue(false);
        if (open == null) {
            return Snapshot.empty(scope);
        }
        var entities = new ArrayList<ObservedEntity>();
        if (scope.isCanvas()) {
            for (int i = 0; i < open.sections.size(); i++) {
                var s = open.sections.get(i);
                entities.add(ObservedEntity.section(s.id, i, s.title));
            }
            section(displayedSectionId).ifPresent(s -> addFields(entities, s));
        } else if (scope.sectionId().equals(displayedSectionId)) {
            section(scope.sectionId()).ifPresent(s -> addFields(entities, s));
        }
        return new Snapshot(scope, entities);
    }

    // -- UiActions --

    @Override
    public synchronized ActionResult click(TargetRef target) {
        record("click", target);
        return switch (target.type()) {
            case CREATE_SECTION -> createSection();
            case FIELD -> clickField(target.key());
            default -> ActionResult.failed("not clickable: " + target);
        };
    }

    @Override
    public synchronized ActionResult drag(TargetRef source, TargetRef destination) {
        record("drag", source);
        if (open == null) {
            return ActionResult.failed("builder not open");
        }
        if (source.type() != TargetRef.Type.TOOLBOX_CARD || destination.type() != TargetRef.Type.DROP_ZONE) {
            return ActionResult.failed("cannot drag " + source + " to " + destination);
        }
        var section = section(destination.key());
        if (section.isEmpty() || !destination.key().equals(displayedSectionId)) {
            return ActionResult.failed("drop zone not visible: " + destination);
        }
        int index;
        if (destination.anchor() == null) {
            index = section.get().fields.size();
        } else if (destination.anchor().isEmpty()) {
            index = 0;
        } else {
            int anchor = indexOf(section.get(), destination.anchor());
            if (anchor < 0) {
                return ActionResult.failed("anchor not rendered: " + destination.anchor());
            }
            index = anchor + 1;
        }

        var behavior = nextDrop();
        String typeKey = source.key();
        long due = clock.nowMillis() + config.getLagDelay().toMillis();
        log.debug("Rehearsal drop of {} into {} at {}: {}", typeKey, section.get().id, index, behavior);
        switch (behavior) {
            case NORMAL -> insert(section.get(), index, typeKey);
            case LAGGED -> pending.add(new PendingRender(due, section.get(), index, newField(typeKey)));
            case SILENT -> { }
            case DOUBLE -> {
                insert(section.get(), index, typeKey);
                insert(section.get(), index + 1, typeKey);
            }
            case LAGGED_DOUBLE -> {
                pending.add(new PendingRender(due, section.get(), index, newField(typeKey)));
                pending.add(new PendingRender(due, section.get(), index + 1, newField(typeKey)));
            }
        }
        return ActionResult.ok();
    }

    @Override
    public synchronized ActionResult select(TargetRef target) {
        record("select", target);
        if (open == null || target.type() != TargetRef.Type.SECTION_ITEM || section(target.key()).isEmpty()) {
            return ActionResult.failed("cannot select " + target);
        }
        boundFieldId = null;
        if (config.getAlignmentLagReads() <= 0) {
            displayedSectionId = target.key();
            nextDisplayedSectionId = null;
        } else {
            nextDisplayedSectionId = target.key();
            displayReadsRemaining = config.getAlignmentLagReads();
        }
        return ActionResult.ok();
    }

    @Override
    public synchronized ActionResult setValue(TargetRef target, String property, String value) {
        record("set " + property, target);
        switch (target.type()) {
            case SECTION_ITEM -> {
                var section = section(target.key());
                if (section.isEmpty() || !"title".equals(property)) {
                    return ActionResult.failed("cannot set " + property + " on " + target);
                }
                if (ignoredSectionTitles > 0) {
                    ignoredSectionTitles--;
                    return ActionResult.ok();
                }
                section.get().title = value;
                return ActionResult.ok();
            }
            case PROPERTIES_PANEL -> {
                var field = boundFieldId == null ? Optional.<RField>empty() : findField(boundFieldId);
                if (field.isEmpty()) {
                    return ActionResult.failed("properties panel is not bound");
                }
                field.get().properties.put(property, value);
                return ActionResult.ok();
            }
            case FIELD -> {
                var field = findField(target.key());
                if (field.isEmpty()) {
                    return ActionResult.failed("no field " + target.key());
                }
                field.get().properties.put(property, value);
                return ActionResult.ok();
            }
            default -> {
                return ActionResult.failed("cannot set " + property + " on " + target);
            }
        }
    }

    @Override
    public synchronized ActionResult refresh() {
        record("refresh", TargetRef.builderRoot());
        renderDue(true);
        boundFieldId = null;
        nextDisplayedSectionId = null;
        displayedSectionId = open == null || open.sections.isEmpty() ? null : open.sections.get(0).id;
        return ActionResult.ok();
    }

    // -- ReadBack --

    @Override
    public synchronized Optional<String> readValue(TargetRef target, String property) {
        renderDue(false);
        return switch (target.type()) {
            case CANVAS_ROOT -> "section-id".equals(property) ? Optional.ofNullable(readDisplayed()) : Optional.empty();
            case BUILDER_ROOT -> "template-id".equals(property) && open != null
                    ? Optional.of(open.id) : Optional.empty();
            case SECTION_ITEM -> "title".equals(property)
                    ? section(target.key()).map(s -> s.title) : Optional.empty();
            case PROPERTIES_PANEL -> boundFieldId == null ? Optional.empty()
                    : findField(boundFieldId).map(f -> f.properties.get(property));
            case FIELD -> findField(target.key()).map(f -> f.properties.get(property));
            default -> Optional.empty();
        };
    }

    // -- BindingProbe --

    @Override
    public synchronized Optional<String> boundFieldId(TargetRef panelScope) {
        return Optional.ofNullable(boundFieldId);
    }

    // -- TemplateDirectory --

    @Override
    public synchronized List<TemplateMatch> findAll(String activityCode, TemplateStatus status) {
        if (crashingListings.contains(activityCode)) {
            throw new IllegalStateException("template listing crashed while searching for " + activityCode);
        }
        return templates.values().stream()
                .filter(t -> t.code.equals(activityCode) && t.status == status)
                .map(Template::toMatch)
                .toList();
    }

    // -- ActivityShells --

    @Override
    public synchronized ActionResult submitShell(ActivitySpec spec) {
        record("submit-shell", TargetRef.createActivity());
        if (failingShells.contains(spec.code())) {
            log.debug("Rehearsal dropping shell submission for {}", spec.code());
            return ActionResult.ok();
        }
        var template = new Template(nextId("tpl"), spec.code(), spec.title(), TemplateStatus.INACTIVE, false);
        templates.put(template.id, template);
        return ActionResult.ok();
    }

    @Override
    public synchronized ActionResult openBuilder(String templateId) {
        record("open-builder", TargetRef.template(templateId));
        var template = templates.get(templateId);
        if (template == null) {
            return ActionResult.failed("no template " + templateId);
        }
        if (stalledBuilders.contains(template.code)) {
            log.debug("Rehearsal leaving builder for {} unopened", template.code);
            return ActionResult.ok();
        }
        open = template;
        pending.clear();
        pendingSections.clear();
        boundFieldId = null;
        nextDisplayedSectionId = null;
        displayedSectionId = template.sections.isEmpty() ? null : template.sections.get(0).id;
        return ActionResult.ok();
    }

    // -- internals --

    private ActionResult createSection() {
        if (open == null) {
            return ActionResult.failed("builder not open");
        }
        if (ignoredSectionCreates > 0) {
            ignoredSectionCreates--;
            return ActionResult.ok();
        }
        var section = new RSection(nextId("sec"), UNTITLED_SECTION);
        if (laggedSectionCreates > 0) {
            laggedSectionCreates--;
            pendingSections.add(new PendingSection(clock.nowMillis() + config.getLagDelay().toMillis(), open, section));
            return ActionResult.ok();
        }
        open.sections.add(section);
        displayedSectionId = section.id;
        nextDisplayedSectionId = null;
        boundFieldId = null;
        return ActionResult.ok();
    }

    private ActionResult clickField(String fieldId) {
        var section = section(displayedSectionId);
        if (section.isEmpty() || indexOf(section.get(), fieldId) < 0) {
            return ActionResult.failed("field not rendered: " + fieldId);
        }
        boolean misbind = misbindsRemaining > 0 || roll(config.getMisbindRate());
        if (misbind) {
            if (misbindsRemaining > 0) {
                misbindsRemaining--;
            }
            boundFieldId = section.get().fields.stream()
                    .map(f -> f.id)
                    .filter(id -> !id.equals(fieldId))
                    .findFirst()
                    .orElse(null);
            log.debug("Rehearsal misbind: clicked {}, panel bound to {}", fieldId, boundFieldId);
        } else {
            boundFieldId = fieldId;
        }
        return ActionResult.ok();
    }

    private String readDisplayed() {
        if (nextDisplayedSectionId != null) {
            if (displayReadsRemaining > 0) {
                displayReadsRemaining--;
            } else {
                displayedSectionId = nextDisplayedSectionId;
                nextDisplayedSectionId = null;
            }
        }
        return displayedSectionId;
    }

    private DropBehavior nextDrop() {
        if (!scriptedDrops.isEmpty()) {
            return scriptedDrops.poll();
        }
        if (roll(config.getPhantomRate())) return DropBehavior.SILENT;
        if (roll(config.getLagRate())) return DropBehavior.LAGGED;
        if (roll(config.getDoubleRenderRate())) return DropBehavior.DOUBLE;
        return DropBehavior.NORMAL;
    }

    private boolean roll(double rate) {
        return rate > 0 && random.nextDouble() < rate;
    }

    private void renderDue(boolean all) {
        long now = clock.nowMillis();
        Iterator<PendingSection> sections = pendingSections.iterator();
        while (sections.hasNext()) {
            var p = sections.next();
            if (all || p.dueMillis <= now) {
                p.template.sections.add(p.section);
                if (p.template == open) {
                    displayedSectionId = p.section.id;
                    nextDisplayedSectionId = null;
                    boundFieldId = null;
                }
                sections.remove();
            }
        }
        Iterator<PendingRender> it = pending.iterator();
        while (it.hasNext()) {
            var p = it.next();
            if (all || p.dueMillis <= now) {
                p.section.fields.add(Math.min(p.index, p.section.fields.size()), p.field);
                it.remove();
            }
        }
    }

    private void insert(RSection section, int index, String typeKey) {
        section.fields.add(Math.min(index, section.fields.size()), newField(typeKey));
    }

    private RField newField(String typeKey) {
        return new RField(nextId("fld"), typeKey);
    }

    private void addFields(List<ObservedEntity> entities, RSection section) {
        for (int i = 0; i < section.fields.size(); i++) {
            var f = section.fields.get(i);
            entities.add(ObservedEntity.field(f.id, section.id, i, f.typeKey));
        }
    }

    private Optional<RSection> section(String id) {
        if (open == null || id == null) {
            return Optional.empty();
        }
        return open.sections.stream().filter(s -> s.id.equals(id)).findFirst();
    }

    private Optional<RField> findField(String id) {
        for (var t : templates.values()) {
            for (var s : t.sections) {
                for (var f : s.fields) {
                    if (f.id.equals(id)) {
                        return Optional.of(f);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static int indexOf(RSection section, String fieldId) {
        for (int i = 0; i < section.fields.size(); i++) {
            if (section.fields.get(i).id.equals(fieldId)) {
                return i;
            }
        }
        return -1;
    }

    private void record(String verb, TargetRef target) {
        actionLog.add(verb + " " + target);
    }

    private String nextId(String prefix) {
        return prefix + "-" + (++sequence);
    }

    private static final class Template {
        final String id;
        final String code;
        final String title;
        final TemplateStatus status;
        final boolean locked;
        final List<RSection> sections = new ArrayList<>();

        Template(String id, String code, String title, TemplateStatus status, boolean locked) {
            this.id = id;
            this.code = code;
            this.title = title;
            this.status = status;
            this.locked = locked;
        }

        TemplateMatch toMatch() {
            return new TemplateMatch(code, title, id, status, locked);
        }
    }

    private static final class RSection {
        final String id;
        String title;
        final List<RField> fields = new ArrayList<>();

        RSection(String id, String title) {
            this.id = id;
            this.title = title;
        }
    }

    private static final class RField {
        final String id;
        final String typeKey;
        final Map<String, String> properties = new LinkedHashMap<>();

        RField(String id, String typeKey) {
            this.id = id;
            this.typeKey = typeKey;
        }
    }

    private record PendingRender(long dueMillis, RSection section, int index, RField field) {}

    private record PendingSection(long dueMillis, Template template, RSection section) {}
}
