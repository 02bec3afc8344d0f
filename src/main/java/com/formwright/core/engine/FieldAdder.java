package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.FieldSpec;
import com.formwright.core.model.Reasons;
import com.formwright.core.phantom.AddRequest;
import com.formwright.core.phantom.PhantomRecovery;
import com.formwright.core.phantom.PhantomResolution;
import com.formwright.core.phantom.PhantomState;
import com.formwright.core.registry.DuplicateIdException;
import com.formwright.core.registry.Field;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.EntityKind;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.ObservedEntity;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import com.formwright.surface.UiObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adds one field by dragging its toolbox card into a section, and registers it only once
 * exactly one new field of the requested type is observed. Re-prove timeouts go to
 * {@link PhantomRecovery}; retryable unrecoverable outcomes start again from scratch, up to
 * {@code formwright.phantom.max-add-attempts}.
 */
@Component
public class FieldAdder {

    private static final Logger log = LoggerFactory.getLogger(FieldAdder.class);

    private final UiActions actions;
    private final UiObserver observer;
    private final VerificationProtocol protocol;
    private final PhantomRecovery phantomRecovery;
    private final FormwrightProperties properties;

    public FieldAdder(UiActions actions, UiObserver observer, VerificationProtocol protocol,
                      PhantomRecovery phantomRecovery, FormwrightProperties properties) {
        this.actions = actions;
        this.observer = observer;
        this.protocol = protocol;
        this.phantomRecovery = phantomRecovery;
        this.properties = properties;
    }

    public AddOutcome add(BuildContext ctx, String sectionId, FieldSpec spec, Placement placement) {
        var config = properties.getPhantom();
        var registry = ctx.registry();
        String reason = Reasons.ADD_UNRECOVERABLE;
        boolean retryable = true;
        int attempt = 0;

        while (attempt < config.getMaxAddAttempts()) {
            attempt++;
            Set<String> knownBefore = new LinkedHashSet<>(registry.knownIds(EntityKind.FIELD));
            var request = new AddRequest(sectionId, spec.typeKey(), expectedOrdinal(ctx, sectionId, placement),
                    knownBefore);
            var destination = destination(sectionId, placement);

            ctx.increment(BuildCounters.DRAG_ATTEMPTS);
            var outcome = ctx.account(protocol.run(Verification.named("add-field")
                    .action(() -> actions.drag(TargetRef.toolboxCard(spec.typeKey()), destination))
                    .expectation(() -> singleNewField(ctx, request))
                    .timeout(config.getAddTimeout())
                    .onTimeout(FailurePolicy.AMBIGUOUS)
                    .build()));

            PhantomResolution resolution;
            if (outcome.isConfirmed()) {
                var entity = outcome.value();
                try {
                    var field = registry.register(Field.confirmed(entity.id(), spec.typeKey(), sectionId,
                            entity.ordinal()));
                    if (entity.ordinal() != request.expectedOrdinal()) {
                        log.warn("Field {} landed at position {}, expected {}", field.id(), entity.ordinal(),
                                request.expectedOrdinal());
                    }
                    ctx.increment(BuildCounters.FIELDS_CONFIRMED);
                    log.info("Field {} ({}) confirmed in section {} at position {}",
                            field.id(), spec.typeKey(), sectionId, field.ordinal());
                    return new AddOutcome(field, false, null, false, attempt);
                } catch (DuplicateIdException e) {
                    log.warn("{} while registering new field; registry has drifted", e.getMessage());
                    resolution = phantomRecovery.resolveDrift(ctx, request);
                }
            } else {
                resolution = phantomRecovery.resolve(ctx, request);
            }

            if (resolution.isRecovered()) {
                var field = resolution.field();
                ctx.increment(BuildCounters.FIELDS_CONFIRMED);
                ctx.emit("field.recovered", Map.of("fieldId", field.id(), "typeKey", spec.typeKey(),
                        "via", resolution.passedThrough(PhantomState.HARD_RESYNC) ? "hard_resync" : "late_candidate"));
                return new AddOutcome(field, true, null, false, attempt);
            }
            reason = resolution.reason();
            retryable = resolution.retryable();
            if (!retryable) {
                break;
            }
            if (attempt < config.getMaxAddAttempts()) {
                log.warn("Add of {} unrecoverable ({}); adding again from scratch (attempt {}/{})",
                        spec.typeKey(), reason, attempt + 1, config.getMaxAddAttempts());
            }
        }
        log.warn("Giving up on {} in section {} after {} attempt(s): {}", spec.key(), sectionId, attempt, reason);
        return new AddOutcome(null, false, reason, retryable, attempt);
    }

    static TargetRef destination(String sectionId, Placement placement) {
        return placement.atEnd()
                ? TargetRef.dropZone(sectionId)
                : TargetRef.dropZoneAfter(sectionId, placement.afterFieldId());
    }

    static int expectedOrdinal(BuildContext ctx, String sectionId, Placement placement) {
        var registry = ctx.registry();
        if (placement.atEnd()) {
            return registry.fields(sectionId).size();
        }
        if (placement.afterFieldId() == null) {
            return 0;
        }
        return registry.field(placement.afterFieldId())
                .map(f -> f.ordinal() + 1)
                .orElse(registry.fields(sectionId).size());
    }

    private Optional<ObservedEntity> singleNewField(BuildContext ctx, AddRequest request) {
        var observed = observer.observe(ObservationScope.section(request.sectionId()));
        var fresh = ctx.registry().diff(observed).newEntities().stream()
                .filter(e -> e.kind() == EntityKind.FIELD)
                .filter(e -> e.typeKey() == null || e.typeKey().equals(request.typeKey()))
                .toList();
        return fresh.size() == 1 ? Optional.of(fresh.get(0)) : Optional.empty();
    }
}
