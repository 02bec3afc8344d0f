package com.formwright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Formwright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setActivity(String activityCode) {
        MDC.put("activityCode", activityCode);
    }

    public static void setSection(String sectionTitle) {
        MDC.put("sectionTitle", sectionTitle);
    }

    public static void setField(String sectionTitle, String fieldKey, int fieldIndex) {
        MDC.put("sectionTitle", sectionTitle);
        MDC.put("fieldKey", fieldKey);
        MDC.put("fieldIndex", String.valueOf(fieldIndex));
    }

    public static void clearField() {
        MDC.remove("fieldKey");
        MDC.remove("fieldIndex");
    }

    public static void clearActivity() {
        MDC.remove("activityCode");
        MDC.remove("sectionTitle");
        clearField();
    }

    public static void clear() {
        MDC.remove("runId");
        clearActivity();
    }
}
