package com.formwright.core.phantom;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.BuildContext;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import com.formwright.surface.UiObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Throws away the registry's view of one section and rebuilds it from a fresh,
 * verified observation: refresh, re-select the section, prove the canvas shows it,
 * observe, rebuild.
 * <p>
 * Budgeted per activity by {@code formwright.phantom.hard-resync-max-per-activity}.
 */
@Component
public class HardResync {

    private static final Logger log = LoggerFactory.getLogger(HardResync.class);

    static final String CANVAS_SECTION_PROPERTY = "section-id";

    private final UiActions actions;
    private final UiObserver observer;
    private final ReadBack readBack;
    private final VerificationProtocol protocol;
    private final FormwrightProperties properties;

    public HardResync(UiActions actions, UiObserver observer, ReadBack readBack,
                      VerificationProtocol protocol, FormwrightProperties properties) {
        this.actions = actions;
        this.observer = observer;
        this.readBack = readBack;
        this.protocol = protocol;
        this.properties = properties;
    }

    public ResyncResult resync(BuildContext ctx, String sectionId, String cause) {
        if (ctx.hardResyncsRemaining() <= 0) {
            log.warn("Hard resync of section {} refused ({}): budget of {} exhausted",
                    sectionId, cause, properties.getPhantom().getHardResyncMaxPerActivity());
            return ResyncResult.budgetExhausted();
        }
        ctx.increment(BuildCounters.HARD_RESYNCS);
        ctx.invalidateAlignment();
        ctx.emit("resync.hard", Map.of("sectionId", sectionId, "cause", cause,
                "remaining", ctx.hardResyncsRemaining()));
        log.warn("Hard resync of section {} ({}), {} left this activity",
                sectionId, cause, ctx.hardResyncsRemaining());

        var refreshed = actions.refresh();
        ctx.add(BuildCounters.ACTIONS, 1);
        if (!refreshed.performed()) {
            log.warn("Refresh was not performed: {}", refreshed.detail());
        }

        var alignment = properties.getAlignment();
        var reselect = ctx.account(protocol.run(Verification.named("resync-select-section")
                .action(() -> actions.select(TargetRef.sectionItem(sectionId)))
                .expectation(() -> canvasShows(sectionId))
                .timeout(alignment.getTimeout())
                .maxAttempts(alignment.getMaxAttempts())
                .onTimeout(FailurePolicy.RETRY)
                .build()));
        if (!reselect.isConfirmed()) {
            log.warn("Hard resync could not prove section {} is displayed", sectionId);
            return ResyncResult.failed();
        }

        var observed = observer.observe(ObservationScope.section(sectionId));
        ctx.registry().rebuildFromObservation(observed);
        ctx.recordAlignment(sectionId, protocol.clock().nowMillis());
        return ResyncResult.rebuilt(observed);
    }

    private Optional<String> canvasShows(String sectionId) {
        return readBack.readValue(TargetRef.canvasRoot(), CANVAS_SECTION_PROPERTY)
                .filter(sectionId::equals);
    }
}
