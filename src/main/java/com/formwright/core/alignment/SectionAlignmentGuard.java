package com.formwright.core.alignment;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.BuildContext;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.model.Reasons;
import com.formwright.core.phantom.HardResync;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.PollingClock;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Makes sure the canvas displays the section the next operation targets.
 * <p>
 * The fast path trusts the last confirmed alignment when nothing has invalidated it since
 * (section creation, hard resync) and it is younger than {@code fast-path-ttl}. The slow path
 * selects the section and proves the canvas root reports it. Repeated slow-path failure
 * escalates to a hard resync; if that fails too the caller skips the field.
 */
@Component
public class SectionAlignmentGuard {

    private static final Logger log = LoggerFactory.getLogger(SectionAlignmentGuard.class);

    static final String CANVAS_SECTION_PROPERTY = "section-id";

    private final UiActions actions;
    private final ReadBack readBack;
    private final VerificationProtocol protocol;
    private final HardResync hardResync;
    private final PollingClock clock;
    private final FormwrightProperties properties;

    public SectionAlignmentGuard(UiActions actions, ReadBack readBack, VerificationProtocol protocol,
                                 HardResync hardResync, PollingClock clock, FormwrightProperties properties) {
        this.actions = actions;
        this.readBack = readBack;
        this.protocol = protocol;
        this.hardResync = hardResync;
        this.clock = clock;
        this.properties = properties;
    }

    public AlignmentResult ensureAligned(BuildContext ctx, String sectionId) {
        if (isFresh(ctx, sectionId)) {
            ctx.increment(BuildCounters.ALIGNMENT_FAST_PATHS);
            log.debug("Section {} still aligned, fast path", sectionId);
            return AlignmentResult.ok(AlignmentResult.Path.FAST);
        }

        ctx.increment(BuildCounters.ALIGNMENT_SLOW_PATHS);
        var config = properties.getAlignment();
        var outcome = ctx.account(protocol.run(Verification.named("align-section")
                .precondition(() -> canvasShows(sectionId).isPresent())
                .action(() -> actions.select(TargetRef.sectionItem(sectionId)))
                .expectation(() -> canvasShows(sectionId))
                .timeout(config.getTimeout())
                .maxAttempts(config.getMaxAttempts())
                .onTimeout(FailurePolicy.RETRY)
                .build()));
        if (outcome.isConfirmed()) {
            ctx.recordAlignment(sectionId, clock.nowMillis());
            log.debug("Section {} aligned after {} action(s)", sectionId, outcome.actions());
            return AlignmentResult.ok(AlignmentResult.Path.SLOW);
        }

        log.warn("Section {} not shown after {} select attempt(s); escalating to hard resync",
                sectionId, outcome.actions());
        var resync = hardResync.resync(ctx, sectionId, "misalignment");
        if (resync.succeeded()) {
            return AlignmentResult.ok(AlignmentResult.Path.RESYNC);
        }
        log.warn("Alignment of section {} exhausted ({})", sectionId, resync.reason());
        return AlignmentResult.failed(AlignmentResult.Path.RESYNC, Reasons.ALIGNMENT_EXHAUSTED);
    }

    private boolean isFresh(BuildContext ctx, String sectionId) {
        if (!ctx.alignedSectionId().map(sectionId::equals).orElse(false)) {
            return false;
        }
        Duration ttl = properties.getAlignment().getFastPathTtl();
        return ttl.isZero() || clock.nowMillis() - ctx.alignedAtMillis() < ttl.toMillis();
    }

    private Optional<String> canvasShows(String sectionId) {
        return readBack.readValue(TargetRef.canvasRoot(), CANVAS_SECTION_PROPERTY)
                .filter(sectionId::equals);
    }
}
