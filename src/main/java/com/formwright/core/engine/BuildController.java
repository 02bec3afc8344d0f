package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.events.BuildEvent;
import com.formwright.core.events.EventBus;
import com.formwright.core.logging.MdcContext;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.model.ActivityStatus;
import com.formwright.core.model.Reasons;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.PollingClock;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.ActivityShells;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.TemplateDirectory;
import com.formwright.surface.TemplateMatch;
import com.formwright.surface.TemplateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Builds activities from parsed specifications, one at a time, against one surface.
 * <p>
 * Per activity: locate, decide, create the shell, open the builder, then sections and
 * fields in specification order, then retry passes. A field failure skips the field; a
 * structural failure (shell, builder, section) fails the activity; nothing an activity does
 * stops the next one. An empty specification list is the only run-fatal condition.
 */
@Service
public class BuildController {

    private static final Logger log = LoggerFactory.getLogger(BuildController.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    static final String TEMPLATE_ID_PROPERTY = "template-id";

    private final TemplateDirectory directory;
    private final ActivityShells shells;
    private final ReadBack readBack;
    private final ActivityLocator locator;
    private final SectionAssembler sectionAssembler;
    private final FieldPipeline pipeline;
    private final RetryPassRunner retryRunner;
    private final VerificationProtocol protocol;
    private final PollingClock clock;
    private final EventBus eventBus;
    private final List<BuildSummarySink> sinks;
    private final FormwrightProperties properties;

    public BuildController(TemplateDirectory directory, ActivityShells shells, ReadBack readBack,
                           ActivityLocator locator, SectionAssembler sectionAssembler, FieldPipeline pipeline,
                           RetryPassRunner retryRunner, VerificationProtocol protocol, PollingClock clock,
                           EventBus eventBus, List<BuildSummarySink> sinks, FormwrightProperties properties) {
        this.directory = directory;
        this.shells = shells;
        this.readBack = readBack;
        this.locator = locator;
        this.sectionAssembler = sectionAssembler;
        this.pipeline = pipeline;
        this.retryRunner = retryRunner;
        this.protocol = protocol;
        this.clock = clock;
        this.eventBus = eventBus;
        this.sinks = sinks;
        this.properties = properties;
    }

    public RunSummary run(List<ActivitySpec> specs) {
        return run(generateRunId(), specs, new RunOptions(properties.getRetry().isEnabled()));
    }

    /**
     * Builds every specification in order.
     *
     * @throws MissingSpecificationException if {@code specs} is null or empty
     */
    public RunSummary run(String runId, List<ActivitySpec> specs, RunOptions options) {
        if (specs == null || specs.isEmpty()) {
            throw new MissingSpecificationException("No activity specifications to build");
        }
        var startedAt = Instant.now();
        MdcContext.setRun(runId);
        try {
            log.info("Run {} starting with {} activit{}", runId, specs.size(), specs.size() == 1 ? "y" : "ies");
            publish(runId, null, "run.started", Map.of("activities", specs.size()));
            notifySinks(sink -> sink.runStarted(runId, specs));

            var outcomes = new ArrayList<ActivityOutcome>();
            for (var spec : specs) {
                var outcome = buildActivity(runId, spec, options);
                outcomes.add(outcome);
                notifySinks(sink -> sink.activityFinished(runId, outcome));
            }

            var summary = new RunSummary(runId, startedAt, outcomes);
            log.info("Run {} finished: {} completed, {} skipped, {} failed", runId,
                    summary.count(ActivityStatus.COMPLETED), summary.count(ActivityStatus.SKIPPED),
                    summary.count(ActivityStatus.FAILED));
            publish(runId, null, "run.completed", Map.of(
                    "completed", summary.count(ActivityStatus.COMPLETED),
                    "skipped", summary.count(ActivityStatus.SKIPPED),
                    "failed", summary.count(ActivityStatus.FAILED)));
            notifySinks(sink -> sink.runFinished(summary));
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    ActivityOutcome buildActivity(String runId, ActivitySpec spec, RunOptions options) {
        MdcContext.setActivity(spec.code());
        var ctx = new BuildContext(runId, spec.code(), eventBus,
                properties.getPhantom().getHardResyncMaxPerActivity(), clock.nowMillis());
        try {
            log.info("Activity {} '{}': {} section(s), {} field(s)", spec.code(), spec.title(),
                    spec.sections().size(), spec.fieldCount());
            ctx.emit("activity.started", Map.of("title", spec.title(), "fields", spec.fieldCount()));
            try {
                return execute(ctx, spec, options);
            } catch (RuntimeException e) {
                log.error("Activity {} failed unexpectedly: {}", spec.code(), e.getMessage(), e);
                return finish(ctx, spec, ActivityStatus.FAILED, Reasons.UNEXPECTED_ERROR, null);
            }
        } finally {
            ctx.close();
            MdcContext.clearActivity();
        }
    }

    private ActivityOutcome execute(BuildContext ctx, ActivitySpec spec, RunOptions options) {
        // locate and decide
        var existing = locator.locate(ctx, spec.code());
        if (existing.isPresent()) {
            var match = existing.get();
            String reason = match.locked() ? Reasons.LOCKED_REQUIRES_REVISION : Reasons.ALREADY_EXISTS;
            return finish(ctx, spec, ActivityStatus.SKIPPED, reason, match.templateId());
        }

        // create the shell; only a template that was not listed before the submission proves it
        var preExisting = listedTemplateIds(spec.code());
        if (!preExisting.isEmpty()) {
            log.info("Templates {} already carry code {} outside the located listings; ignoring them",
                    preExisting, spec.code());
        }
        var shell = ctx.account(protocol.run(Verification.named("create-shell")
                .action(() -> shells.submitShell(spec))
                .expectation(() -> findNew(spec.code(), preExisting))
                .timeout(properties.getBuild().getShellTimeout())
                .onTimeout(FailurePolicy.RETRY)
                .build()));
        if (!shell.isConfirmed()) {
            log.error("Activity shell for {} never appeared in the template listings", spec.code());
            return finish(ctx, spec, ActivityStatus.FAILED, Reasons.SHELL_CREATE_FAILED, null);
        }
        String templateId = shell.value().templateId();
        log.info("Activity shell {} created", templateId);

        // open the builder
        var builder = TargetRef.builderRoot();
        var opened = ctx.account(protocol.run(Verification.named("open-builder")
                .precondition(() -> builderShows(builder, templateId).isPresent())
                .action(() -> shells.openBuilder(templateId))
                .expectation(() -> builderShows(builder, templateId))
                .timeout(properties.getBuild().getShellTimeout())
                .maxAttempts(properties.getVerification().getDefaultMaxAttempts())
                .onTimeout(FailurePolicy.RETRY)
                .build()));
        if (!opened.isConfirmed()) {
            log.error("Builder for {} could not be proven open", templateId);
            return finish(ctx, spec, ActivityStatus.FAILED, Reasons.BUILDER_OPEN_FAILED, templateId);
        }
        ctx.invalidateAlignment();

        // sections and fields, in specification order
        var streak = new FailureStreak(properties.getBuild().getConsecutiveFailureThreshold());
        int fieldIndex = 0;
        for (var sectionSpec : spec.sections()) {
            MdcContext.setSection(sectionSpec.title());
            var section = sectionAssembler.ensureSection(ctx, sectionSpec);
            if (!section.isReady()) {
                log.error("Section '{}' could not be established", sectionSpec.title());
                return finish(ctx, spec, ActivityStatus.FAILED, section.reason(), templateId);
            }
            for (var fieldSpec : sectionSpec.fields()) {
                var failure = pipeline.place(ctx, section.section().id(), sectionSpec.title(), fieldSpec,
                        fieldIndex, Placement.append());
                if (failure.isPresent()) {
                    ctx.recordFailure(failure.get());
                    streak.recordFailure(failure.get().reason());
                    if (streak.isTripped()) {
                        log.error("{} consecutive field failures ({}); abandoning activity",
                                streak.length(), streak.reasons());
                        return finish(ctx, spec, ActivityStatus.FAILED, Reasons.CONSECUTIVE_FAILURES, templateId);
                    }
                } else {
                    streak.recordSuccess();
                }
                fieldIndex++;
            }
        }

        if (options.retryEnabled() && !ctx.failures().isEmpty()) {
            int recovered = retryRunner.run(ctx, spec);
            if (recovered > 0) {
                log.info("Retry passes recovered {} field(s)", recovered);
            }
        }
        return finish(ctx, spec, ActivityStatus.COMPLETED, null, templateId);
    }

    private ActivityOutcome finish(BuildContext ctx, ActivitySpec spec, ActivityStatus status,
                                   String reason, String templateId) {
        var failures = ctx.failures();
        ctx.add(BuildCounters.FIELDS_SKIPPED, failures.size());
        long elapsed = clock.nowMillis() - ctx.startedAtMillis();
        var outcome = new ActivityOutcome(spec.code(), spec.title(), status, reason, templateId,
                ctx.counters(), ctx.ticks(), elapsed, spec.fieldCount(), failures, spec.source());

        var payload = new HashMap<String, Object>();
        payload.put("status", status.name());
        payload.put("fieldsSkipped", failures.size());
        if (reason != null) {
            payload.put("reason", reason);
        }
        switch (status) {
            case COMPLETED -> {
                log.info("Activity {} completed: {} of {} field(s) confirmed, {} skipped, {} ticks",
                        spec.code(), ctx.count(BuildCounters.FIELDS_CONFIRMED), spec.fieldCount(),
                        failures.size(), ctx.ticks());
                ctx.emit("activity.completed", payload);
            }
            case SKIPPED -> {
                log.warn("Activity {} skipped: {}", spec.code(), reason);
                ctx.emit("activity.skipped", payload);
            }
            case FAILED -> {
                log.error("Activity {} failed: {}", spec.code(), reason);
                ctx.emit("activity.failed", payload);
            }
        }
        return outcome;
    }

    private Set<String> listedTemplateIds(String code) {
        var ids = new HashSet<String>();
        for (var status : List.of(TemplateStatus.INACTIVE, TemplateStatus.ACTIVE)) {
            directory.findAll(code, status).forEach(match -> ids.add(match.templateId()));
        }
        return ids;
    }

    private Optional<TemplateMatch> findNew(String code, Set<String> preExisting) {
        for (var status : List.of(TemplateStatus.INACTIVE, TemplateStatus.ACTIVE)) {
            var created = directory.findAll(code, status).stream()
                    .filter(match -> !preExisting.contains(match.templateId()))
                    .findFirst();
            if (created.isPresent()) {
                return created;
            }
        }
        return Optional.empty();
    }

    private Optional<String> builderShows(TargetRef builder, String templateId) {
        return readBack.readValue(builder, TEMPLATE_ID_PROPERTY).filter(templateId::equals);
    }

    private void publish(String runId, String activityCode, String type, Map<String, Object> payload) {
        eventBus.publish(new BuildEvent(type, runId, activityCode, payload, Instant.now()));
    }

    private void notifySinks(Consumer<BuildSummarySink> call) {
        for (var sink : sinks) {
            try {
                call.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Summary sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        var now = Instant.now().atZone(ZoneOffset.UTC);
        return String.format("FW-%04d%02d%02d-%02d%02d%02d-%04d", now.getYear(), now.getMonthValue(),
                now.getDayOfMonth(), now.getHour(), now.getMinute(), now.getSecond(), count);
    }
}
