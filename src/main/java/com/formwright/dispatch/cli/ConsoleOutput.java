package com.formwright.dispatch.cli;

import com.formwright.core.engine.ActivityOutcome;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.engine.RunSummary;
import com.formwright.core.events.BuildEvent;
import com.formwright.core.model.ActivityStatus;
import com.formwright.core.model.FailureRecord;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Formwright CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORMWRIGHT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORMWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void activity(ActivityOutcome outcome) {
        String status = switch (outcome.status()) {
            case COMPLETED -> "@|fg(green) COMPLETED|@";
            case SKIPPED -> "@|fg(yellow) SKIPPED|@";
            case FAILED -> "@|fg(red) FAILED|@";
        };
        String detail = outcome.status() == ActivityStatus.COMPLETED
                ? outcome.counter(BuildCounters.FIELDS_CONFIRMED) + "/" + outcome.fieldsRequested() + " fields"
                : outcome.reason();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + outcome.code() + " (" + detail + ", "
                        + formatDuration(outcome.elapsedMillis()) + ")"));
        for (FailureRecord f : outcome.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + f.sectionTitle() + " #" + f.fieldIndex() + " " + f.typeKey()
                            + ": " + f.reason()));
        }
    }

    public static void summary(RunSummary summary) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + summary.runId() + "|@"));
        for (var outcome : summary.activities()) {
            activity(outcome);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Activities: @|fg(green) " + summary.count(ActivityStatus.COMPLETED) + " completed|@, "
                        + "@|fg(yellow) " + summary.count(ActivityStatus.SKIPPED) + " skipped|@, "
                        + "@|fg(red) " + summary.count(ActivityStatus.FAILED) + " failed|@"));
    }

    public static void watchEvent(BuildEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started", "run.completed" -> "@|bold,fg(cyan) [RUN]|@";
            case "activity.started" -> "@|fg(blue) [ACTIVITY]|@";
            case "activity.completed" -> "@|fg(green),bold [ACTIVITY]|@";
            case "activity.skipped" -> "@|fg(yellow),bold [ACTIVITY]|@";
            case "activity.failed" -> "@|fg(red),bold [ACTIVITY]|@";
            case "section.created" -> "@|fg(blue) [SECTION]|@";
            case "field.confirmed" -> "@|fg(green) [FIELD]|@";
            case "field.skipped" -> "@|fg(red) [FIELD]|@";
            case "field.recovered", "resync.hard" -> "@|fg(magenta) [RECOVERY]|@";
            case "retry.pass" -> "@|bold,fg(yellow) [RETRY]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.activityCode() != null ? event.activityCode() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + event.eventType() + " " + formatPayload(event.payload())));
    }

    static String formatPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        return payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining(" "));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
