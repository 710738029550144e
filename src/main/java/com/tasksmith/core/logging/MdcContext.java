package com.tasksmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tasksmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setRun(String planId, String taskId, String runId) {
        MDC.put("planId", planId);
        MDC.put("taskId", taskId);
        MDC.put("runId", runId);
    }

    public static void setPhase(String planId, int phaseNumber) {
        MDC.put("planId", planId);
        MDC.put("phase", String.valueOf(phaseNumber));
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("taskId");
        MDC.remove("runId");
        MDC.remove("phase");
    }
}
