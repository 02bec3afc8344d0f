package com.formwright.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every tunable of the build engine, bound from {@code formwright.*}.
 * <p>
 * Timeouts and budgets are policy knobs. None of them replaces a re-prove step.
 */
@Component
@ConfigurationProperties(prefix = "formwright")
public class FormwrightProperties {

    private Verification verification = new Verification();
    private Alignment alignment = new Alignment();
    private Phantom phantom = new Phantom();
    private Binding binding = new Binding();
    private Build build = new Build();
    private Retry retry = new Retry();
    private Run run = new Run();
    private Surface surface = new Surface();
    private Map<String, List<String>> capabilities = new LinkedHashMap<>();

    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }
    public Alignment getAlignment() { return alignment; }
    public void setAlignment(Alignment alignment) { this.alignment = alignment; }
    public Phantom getPhantom() { return phantom; }
    public void setPhantom(Phantom phantom) { this.phantom = phantom; }
    public Binding getBinding() { return binding; }
    public void setBinding(Binding binding) { this.binding = binding; }
    public Build getBuild() { return build; }
    public void setBuild(Build build) { this.build = build; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Surface getSurface() { return surface; }
    public void setSurface(Surface surface) { this.surface = surface; }
    public Map<String, List<String>> getCapabilities() { return capabilities; }
    public void setCapabilities(Map<String, List<String>> capabilities) { this.capabilities = capabilities; }

    public static class Verification {
        private Duration pollInterval = Duration.ofMillis(150);
        private Duration defaultTimeout = Duration.ofSeconds(6);
        private int defaultMaxAttempts = 2;

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
        public void setDefaultMaxAttempts(int defaultMaxAttempts) { this.defaultMaxAttempts = defaultMaxAttempts; }
    }

    public static class Alignment {
        private Duration timeout = Duration.ofSeconds(3);
        private int maxAttempts = 2;
        /** How long a confirmed alignment may be trusted without re-reading. Zero disables expiry. */
        private Duration fastPathTtl = Duration.ofMinutes(2);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getFastPathTtl() { return fastPathTtl; }
        public void setFastPathTtl(Duration fastPathTtl) { this.fastPathTtl = fastPathTtl; }
    }

    public static class Phantom {
        private Duration addTimeout = Duration.ofSeconds(6);
        private Duration lateCandidateGrace = Duration.ofMillis(750);
        private int maxAddAttempts = 2;
        private int hardResyncMaxPerActivity = 3;

        public Duration getAddTimeout() { return addTimeout; }
        public void setAddTimeout(Duration addTimeout) { this.addTimeout = addTimeout; }
        public Duration getLateCandidateGrace() { return lateCandidateGrace; }
        public void setLateCandidateGrace(Duration lateCandidateGrace) { this.lateCandidateGrace = lateCandidateGrace; }
        public int getMaxAddAttempts() { return maxAddAttempts; }
        public void setMaxAddAttempts(int maxAddAttempts) { this.maxAddAttempts = maxAddAttempts; }
        public int getHardResyncMaxPerActivity() { return hardResyncMaxPerActivity; }
        public void setHardResyncMaxPerActivity(int max) { this.hardResyncMaxPerActivity = max; }
    }

    public static class Binding {
        private Duration timeout = Duration.ofSeconds(3);
        private int maxAttempts = 3;
        private Duration writeTimeout = Duration.ofSeconds(2);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getWriteTimeout() { return writeTimeout; }
        public void setWriteTimeout(Duration writeTimeout) { this.writeTimeout = writeTimeout; }
    }

    public static class Build {
        private LocatePolicy locatePolicy = LocatePolicy.ACTIVE_THEN_INACTIVE;
        /** Consecutive field failures that abort the rest of an activity. Zero disables. */
        private int consecutiveFailureThreshold = 5;
        private Duration shellTimeout = Duration.ofSeconds(10);
        private Duration sectionTimeout = Duration.ofSeconds(6);

        public LocatePolicy getLocatePolicy() { return locatePolicy; }
        public void setLocatePolicy(LocatePolicy locatePolicy) { this.locatePolicy = locatePolicy; }
        public int getConsecutiveFailureThreshold() { return consecutiveFailureThreshold; }
        public void setConsecutiveFailureThreshold(int threshold) { this.consecutiveFailureThreshold = threshold; }
        public Duration getShellTimeout() { return shellTimeout; }
        public void setShellTimeout(Duration shellTimeout) { this.shellTimeout = shellTimeout; }
        public Duration getSectionTimeout() { return sectionTimeout; }
        public void setSectionTimeout(Duration sectionTimeout) { this.sectionTimeout = sectionTimeout; }
    }

    public enum LocatePolicy {
        ACTIVE_THEN_INACTIVE,
        INACTIVE_THEN_ACTIVE,
        ACTIVE_ONLY
    }

    public static class Retry {
        private boolean enabled = true;
        private int maxPasses = 2;
        private int failureThreshold = 5;
        private boolean retryableOnly = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxPasses() { return maxPasses; }
        public void setMaxPasses(int maxPasses) { this.maxPasses = maxPasses; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public boolean isRetryableOnly() { return retryableOnly; }
        public void setRetryableOnly(boolean retryableOnly) { this.retryableOnly = retryableOnly; }
    }

    public static class Run {
        private Path outputDir = Path.of("runs");
        private boolean record = true;

        public Path getOutputDir() { return outputDir; }
        public void setOutputDir(Path outputDir) { this.outputDir = outputDir; }
        public boolean isRecord() { return record; }
        public void setRecord(boolean record) { this.record = record; }
    }

    public static class Surface {
        private String provider = "rehearsal";
        private Rehearsal rehearsal = new Rehearsal();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public Rehearsal getRehearsal() { return rehearsal; }
        public void setRehearsal(Rehearsal rehearsal) { this.rehearsal = rehearsal; }
    }

    public static class Rehearsal {
        private long seed = 42L;
        private double phantomRate = 0.0;
        private double lagRate = 0.0;
        private Duration lagDelay = Duration.ofMillis(600);
        private double doubleRenderRate = 0.0;
        private int alignmentLagReads = 0;
        private double misbindRate = 0.0;
        /** Templates that already exist, as {@code CODE[:inactive][:locked]}. */
        private List<String> existingTemplates = new ArrayList<>();

        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }
        public double getPhantomRate() { return phantomRate; }
        public void setPhantomRate(double phantomRate) { this.phantomRate = phantomRate; }
        public double getLagRate() { return lagRate; }
        public void setLagRate(double lagRate) { this.lagRate = lagRate; }
        public Duration getLagDelay() { return lagDelay; }
        public void setLagDelay(Duration lagDelay) { this.lagDelay = lagDelay; }
        public double getDoubleRenderRate() { return doubleRenderRate; }
        public void setDoubleRenderRate(double doubleRenderRate) { this.doubleRenderRate = doubleRenderRate; }
        public int getAlignmentLagReads() { return alignmentLagReads; }
        public void setAlignmentLagReads(int alignmentLagReads) { this.alignmentLagReads = alignmentLagReads; }
        public double getMisbindRate() { return misbindRate; }
        public void setMisbindRate(double misbindRate) { this.misbindRate = misbindRate; }
        public List<String> getExistingTemplates() { return existingTemplates; }
        public void setExistingTemplates(List<String> existingTemplates) { this.existingTemplates = existingTemplates; }
    }
}
