package com.formwright.core.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.ActivityOutcome;
import com.formwright.core.engine.BuildSummarySink;
import com.formwright.core.engine.RunSummary;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.model.ActivityStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a run's records as JSON under {@code <output-dir>/<run-id>/}:
 * {@code run_meta.json} when the run starts (rewritten with totals when it ends) and
 * {@code activities/<code>_summary.json} per finished activity.
 * <p>
 * Recording is best effort; an I/O failure is logged and the build carries on.
 */
@Component
public class RunRecorder implements BuildSummarySink {

    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    static final String META_FILE = "run_meta.json";
    static final String ACTIVITIES_DIR = "activities";

    private final FormwrightProperties properties;
    private final ObjectMapper objectMapper;

    public RunRecorder(FormwrightProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path runDir(String runId) {
        return properties.getRun().getOutputDir().resolve(runId);
    }

    @Override
    public void runStarted(String runId, List<ActivitySpec> specs) {
        if (!properties.getRun().isRecord()) {
            return;
        }
        var meta = new LinkedHashMap<String, Object>();
        meta.put("runId", runId);
        meta.put("startedAt", Instant.now());
        meta.put("specs", specs.stream().map(ActivitySpec::source).filter(Objects::nonNull).distinct().toList());
        meta.put("activities", specs.stream().map(ActivitySpec::code).toList());
        meta.put("activityCount", specs.size());
        write(runDir(runId).resolve(META_FILE), meta);
    }

    @Override
    public void activityFinished(String runId, ActivityOutcome outcome) {
        if (!properties.getRun().isRecord()) {
            return;
        }
        write(runDir(runId).resolve(ACTIVITIES_DIR).resolve(safeName(outcome.code()) + "_summary.json"), outcome);
    }

    @Override
    public void runFinished(RunSummary summary) {
        if (!properties.getRun().isRecord()) {
            return;
        }
        Path metaPath = runDir(summary.runId()).resolve(META_FILE);
        Map<String, Object> meta = new LinkedHashMap<>();
        try {
            if (Files.exists(metaPath)) {
                @SuppressWarnings("unchecked")
                Map<String, Object> existing = objectMapper.readValue(metaPath.toFile(), Map.class);
                meta.putAll(existing);
            }
        } catch (IOException e) {
            log.warn("Could not re-read {}: {}", metaPath, e.getMessage());
        }
        meta.put("runId", summary.runId());
        meta.put("finishedAt", Instant.now());
        meta.put("completed", summary.count(ActivityStatus.COMPLETED));
        meta.put("skipped", summary.count(ActivityStatus.SKIPPED));
        meta.put("failed", summary.count(ActivityStatus.FAILED));
        write(metaPath, meta);
    }

    private void write(Path path, Object value) {
        try {
            Files.createDirectories(path.getParent());
            objectMapper.writeValue(path.toFile(), value);
            log.debug("Wrote {}", path);
        } catch (IOException e) {
            log.warn("Failed to write run record {}: {}", path, e.getMessage());
        }
    }

    static String safeName(String code) {
        return code.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
