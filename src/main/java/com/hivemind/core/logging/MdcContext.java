package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setAttempt(int attempt) {
        MDC.put("runAttempt", String.valueOf(attempt));
    }

    public static void setTask(String rootTaskId, String taskId) {
        MDC.put("rootTaskId", rootTaskId);
        MDC.put("taskId", taskId);
    }

    public static void setRoot(String rootTaskId) {
        MDC.put("rootTaskId", rootTaskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("runAttempt");
        MDC.remove("rootTaskId");
        MDC.remove("taskId");
    }
}
