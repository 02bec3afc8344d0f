package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.Reasons;
import com.formwright.core.model.SectionSpec;
import com.formwright.core.registry.Section;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.PollingClock;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.EntityKind;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.ObservedEntity;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import com.formwright.surface.UiObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Makes sure a specification section exists in the registry: reuses a confirmed section
 * with the same title, or creates one and proves both its appearance and its title.
 * <p>
 * Creation is never clicked twice. If the new section cannot be told apart after one
 * late look, section creation has failed.
 */
@Component
public class SectionAssembler {

    private static final Logger log = LoggerFactory.getLogger(SectionAssembler.class);

    static final String TITLE_PROPERTY = "title";

    private final UiActions actions;
    private final UiObserver observer;
    private final ReadBack readBack;
    private final VerificationProtocol protocol;
    private final PollingClock clock;
    private final FormwrightProperties properties;

    public SectionAssembler(UiActions actions, UiObserver observer, ReadBack readBack,
                            VerificationProtocol protocol, PollingClock clock, FormwrightProperties properties) {
        this.actions = actions;
        this.observer = observer;
        this.readBack = readBack;
        this.protocol = protocol;
        this.clock = clock;
        this.properties = properties;
    }

    public SectionResult ensureSection(BuildContext ctx, SectionSpec spec) {
        var registry = ctx.registry();
        var existing = registry.findSectionByTitle(spec.title());
        if (existing.isPresent()) {
            log.debug("Section '{}' already confirmed as {}", spec.title(), existing.get().id());
            return new SectionResult(existing.get(), false, null);
        }

        Set<String> knownBefore = Set.copyOf(registry.knownIds(EntityKind.SECTION));
        var timeout = properties.getBuild().getSectionTimeout();
        var created = ctx.account(protocol.run(Verification.named("create-section")
                .action(() -> actions.click(TargetRef.createSection()))
                .expectation(() -> singleNewSection(knownBefore))
                .timeout(timeout)
                .onTimeout(FailurePolicy.AMBIGUOUS)
                .build()));

        Optional<ObservedEntity> entity = created.confirmedValue();
        if (entity.isEmpty()) {
            clock.sleep(properties.getPhantom().getLateCandidateGrace());
            entity = singleNewSection(knownBefore);
            if (entity.isEmpty()) {
                log.warn("New section for '{}' could not be identified", spec.title());
                return new SectionResult(null, false, Reasons.SECTION_CREATE_FAILED);
            }
            log.warn("Section for '{}' confirmed late as {}", spec.title(), entity.get().id());
        }

        var section = registry.register(new Section(entity.get().id(), null, entity.get().ordinal()));
        ctx.increment(BuildCounters.SECTIONS_CREATED);
        ctx.invalidateAlignment();

        var target = TargetRef.sectionItem(section.id());
        var renamed = ctx.account(protocol.run(Verification.named("title-section")
                .precondition(() -> titleIs(target, spec.title()).isPresent())
                .action(() -> actions.setValue(target, TITLE_PROPERTY, spec.title()))
                .expectation(() -> titleIs(target, spec.title()))
                .timeout(timeout)
                .maxAttempts(properties.getVerification().getDefaultMaxAttempts())
                .onTimeout(FailurePolicy.RETRY)
                .build()));
        if (!renamed.isConfirmed()) {
            log.warn("Section {} created but its title never read back as '{}'", section.id(), spec.title());
            return new SectionResult(null, true, Reasons.SECTION_CREATE_FAILED);
        }
        registry.retitle(section.id(), spec.title());
        ctx.emit("section.created", Map.of("sectionId", section.id(), "title", spec.title()));
        log.info("Section '{}' created as {}", spec.title(), section.id());
        return new SectionResult(registry.section(section.id()).orElse(section), true, null);
    }

    private Optional<ObservedEntity> singleNewSection(Set<String> knownBefore) {
        List<ObservedEntity> fresh = observer.observe(ObservationScope.canvas()).ofKind(EntityKind.SECTION).stream()
                .filter(e -> !knownBefore.contains(e.id()))
                .toList();
        return fresh.size() == 1 ? Optional.of(fresh.get(0)) : Optional.empty();
    }

    private Optional<String> titleIs(TargetRef target, String title) {
        return readBack.readValue(target, TITLE_PROPERTY).filter(title::equals);
    }
}
