package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.model.FailureRecord;
import com.formwright.core.model.FieldSpec;
import com.formwright.core.model.SectionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gives skipped fields another chance after the main pass, in specification order.
 * <p>
 * A field that never made it onto the canvas is added again directly after the nearest
 * confirmed field that precedes it in the same section (or at the section top). A field
 * that was confirmed, whatever later step failed, is aligned, bound and configured again in place.
 * Every retry goes through the same verification and phantom handling as the main pass.
 */
@Component
public class RetryPassRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryPassRunner.class);

    private final FieldPipeline pipeline;
    private final FormwrightProperties properties;

    public RetryPassRunner(FieldPipeline pipeline, FormwrightProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    /**
     * Runs up to {@code formwright.retry.max-passes} passes.
     *
     * @return number of fields that succeeded on retry
     */
    public int run(BuildContext ctx, ActivitySpec spec) {
        var config = properties.getRetry();
        var fields = flatten(spec);
        int recovered = 0;

        for (int pass = 1; pass <= config.getMaxPasses(); pass++) {
            var candidates = new ArrayList<>(ctx.drainFailures(f -> !config.isRetryableOnly() || f.retryable()));
            if (candidates.isEmpty()) {
                break;
            }
            candidates.sort(Comparator.comparingInt(FailureRecord::fieldIndex));
            ctx.increment(BuildCounters.RETRY_PASSES);
            ctx.emit("retry.pass", Map.of("pass", pass, "fields", candidates.size()));
            log.info("Retry pass {}/{}: {} field(s)", pass, config.getMaxPasses(), candidates.size());

            var streak = new FailureStreak(config.getFailureThreshold());
            int passRecovered = 0;
            for (int i = 0; i < candidates.size(); i++) {
                if (streak.isTripped()) {
                    log.warn("Retry pass {} stopped after {} consecutive failures; {} field(s) not retried",
                            pass, streak.length(), candidates.size() - i);
                    candidates.subList(i, candidates.size()).forEach(ctx::recordFailure);
                    break;
                }
                var failure = candidates.get(i);
                var result = retry(ctx, failure, fields);
                if (result.isPresent()) {
                    ctx.recordFailure(result.get());
                    streak.recordFailure(result.get().reason());
                } else {
                    streak.recordSuccess();
                    passRecovered++;
                }
            }
            recovered += passRecovered;
            if (passRecovered == 0) {
                log.info("Retry pass {} recovered nothing; stopping", pass);
                break;
            }
        }
        return recovered;
    }

    private Optional<FailureRecord> retry(BuildContext ctx, FailureRecord failure, List<Slot> fields) {
        if (failure.fieldIndex() < 0 || failure.fieldIndex() >= fields.size()) {
            return Optional.of(failure);
        }
        var slot = fields.get(failure.fieldIndex());
        var registry = ctx.registry();
        var section = registry.findSectionByTitle(slot.section().title());
        if (section.isEmpty()) {
            log.warn("Section '{}' no longer confirmed; cannot retry {}", slot.section().title(), failure.fieldKey());
            return Optional.of(failure);
        }
        ctx.increment(BuildCounters.FIELDS_RETRIED);

        // a field the registry still knows is on the canvas; adding it again would duplicate it
        var existing = Optional.ofNullable(failure.fieldId()).flatMap(registry::field);
        if (existing.isPresent()) {
            return pipeline.finish(ctx, existing.get(), slot.section().title(), slot.field(), failure.fieldIndex());
        }
        var placement = anchorFor(ctx, fields, failure.fieldIndex(), section.get().id());
        return pipeline.place(ctx, section.get().id(), slot.section().title(), slot.field(),
                failure.fieldIndex(), placement);
    }

    static Placement anchorFor(BuildContext ctx, List<Slot> fields, int fieldIndex, String sectionId) {
        var registry = ctx.registry();
        String sectionTitle = fields.get(fieldIndex).section().title();
        for (int j = fieldIndex - 1; j >= 0; j--) {
            if (!fields.get(j).section().title().equals(sectionTitle)) {
                break;
            }
            var anchor = ctx.confirmedFieldId(j)
                    .flatMap(registry::field)
                    .filter(f -> f.sectionId().equals(sectionId));
            if (anchor.isPresent()) {
                return Placement.after(anchor.get().id());
            }
        }
        return Placement.top();
    }

    static List<Slot> flatten(ActivitySpec spec) {
        var slots = new ArrayList<Slot>();
        for (var section : spec.sections()) {
            for (var field : section.fields()) {
                slots.add(new Slot(section, field));
            }
        }
        return slots;
    }

    record Slot(SectionSpec section, FieldSpec field) {}
}
