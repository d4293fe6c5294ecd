package com.tandem.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tandem-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskId, String workerType) {
        if (sessionId != null) {
            MDC.put("sessionId", sessionId);
        }
        MDC.put("taskId", taskId);
        MDC.put("workerType", workerType);
    }

    public static void setWave(String sessionId, int waveNumber) {
        MDC.put("sessionId", sessionId);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("workerType");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskId");
        MDC.remove("workerType");
        MDC.remove("waveNumber");
    }
}
