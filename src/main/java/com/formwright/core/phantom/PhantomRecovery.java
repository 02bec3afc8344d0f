package com.formwright.core.phantom;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.BuildContext;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.model.Reasons;
import com.formwright.core.registry.Field;
import com.formwright.core.verify.PollingClock;
import com.formwright.surface.EntityKind;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.ObservedEntity;
import com.formwright.surface.UiObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves add-field actions whose re-prove timed out.
 * <p>
 * {@code DROPPED -> LATE_CANDIDATE_CHECK -> (RECOVERED | HARD_RESYNC -> (RECOVERED | UNRECOVERABLE))}.
 * A late candidate is accepted only when it is the single new typed entity in the section
 * and sits at the expected position. Two or more plausible candidates always go to a hard
 * resync, and a resync that still sees two or more is unrecoverable. Nothing here picks
 * one candidate out of several.
 */
@Component
public class PhantomRecovery {

    private static final Logger log = LoggerFactory.getLogger(PhantomRecovery.class);

    private final UiObserver observer;
    private final HardResync hardResync;
    private final PollingClock clock;
    private final FormwrightProperties properties;

    public PhantomRecovery(UiObserver observer, HardResync hardResync, PollingClock clock,
                           FormwrightProperties properties) {
        this.observer = observer;
        this.hardResync = hardResync;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Resolves an add whose re-prove timed out.
     */
    public PhantomResolution resolve(BuildContext ctx, AddRequest request) {
        var trail = new ArrayList<PhantomState>();
        trail.add(PhantomState.DROPPED);
        ctx.increment(BuildCounters.PHANTOM_TIMEOUTS);
        log.warn("Add of {} into section {} not confirmed in time; checking for a late candidate",
                request.typeKey(), request.sectionId());

        trail.add(PhantomState.LATE_CANDIDATE_CHECK);
        clock.sleep(properties.getPhantom().getLateCandidateGrace());
        var observed = observer.observe(ObservationScope.section(request.sectionId()));
        var candidates = candidates(ctx, request, observed.fieldsIn(request.sectionId()));

        if (candidates.size() == 1 && candidates.get(0).ordinal() == request.expectedOrdinal()) {
            var candidate = candidates.get(0);
            var field = ctx.registry().register(Field.confirmed(candidate.id(), request.typeKey(),
                    request.sectionId(), candidate.ordinal()));
            ctx.increment(BuildCounters.LATE_CANDIDATES);
            log.warn("Accepted late candidate {} at position {}", field.id(), field.ordinal());
            return PhantomResolution.recovered(field, trail);
        }

        if (candidates.size() > 1) {
            log.warn("{} plausible candidates after grace period ({}); refusing to choose, resyncing",
                    candidates.size(), ids(candidates));
        } else if (candidates.size() == 1) {
            log.warn("Single late candidate {} is at position {}, expected {}; resyncing",
                    candidates.get(0).id(), candidates.get(0).ordinal(), request.expectedOrdinal());
        } else {
            log.warn("No late candidate after grace period; resyncing");
        }
        return resyncAndDiff(ctx, request, trail, "phantom_add");
    }

    /**
     * Resolves an add whose registration collided with a known id: the registry has drifted,
     * so the only way forward is a rebuild.
     */
    public PhantomResolution resolveDrift(BuildContext ctx, AddRequest request) {
        var trail = new ArrayList<PhantomState>();
        trail.add(PhantomState.DROPPED);
        log.warn("Registry drift while adding {} to section {}; resyncing", request.typeKey(), request.sectionId());
        return resyncAndDiff(ctx, request, trail, "duplicate_id");
    }

    private PhantomResolution resyncAndDiff(BuildContext ctx, AddRequest request,
                                            List<PhantomState> trail, String cause) {
        trail.add(PhantomState.HARD_RESYNC);
        var result = hardResync.resync(ctx, request.sectionId(), cause);
        if (!result.succeeded()) {
            boolean retryable = !Reasons.HARD_RESYNC_BUDGET_EXHAUSTED.equals(result.reason());
            log.warn("Field {} unrecoverable: {}", request.typeKey(), result.reason());
            ctx.increment(BuildCounters.PHANTOMS_UNRECOVERABLE);
            return PhantomResolution.unrecoverable(result.reason(), retryable, trail);
        }

        var fresh = ctx.registry().fields(request.sectionId()).stream()
                .filter(f -> !request.knownBefore().contains(f.id()))
                .filter(f -> f.typeKey() == null || f.typeKey().equals(request.typeKey()))
                .toList();

        if (fresh.size() == 1) {
            var field = fresh.get(0);
            log.warn("Hard resync confirmed exactly one new field {} at position {}", field.id(), field.ordinal());
            ctx.increment(BuildCounters.PHANTOMS_RESYNCED);
            return PhantomResolution.recovered(field, trail);
        }
        ctx.increment(BuildCounters.PHANTOMS_UNRECOVERABLE);
        if (fresh.isEmpty()) {
            log.warn("Hard resync shows no new {} in section {}", request.typeKey(), request.sectionId());
            return PhantomResolution.unrecoverable(Reasons.FIELD_ABSENT_AFTER_RESYNC, true, trail);
        }
        log.warn("Hard resync shows {} new fields {}; cannot tell which one was intended",
                fresh.size(), fresh.stream().map(Field::id).toList());
        return PhantomResolution.unrecoverable(Reasons.AMBIGUOUS_CANDIDATES, false, trail);
    }

    private static List<ObservedEntity> candidates(BuildContext ctx, AddRequest request,
                                                   List<ObservedEntity> observed) {
        var known = ctx.registry().knownIds(EntityKind.FIELD);
        return observed.stream()
                .filter(e -> !known.contains(e.id()))
                .filter(e -> e.typeKey() == null || e.typeKey().equals(request.typeKey()))
                .toList();
    }

    private static List<String> ids(List<ObservedEntity> entities) {
        return entities.stream().map(ObservedEntity::id).toList();
    }
}
