package com.reqminer.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing mining-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String NODE = "node";

    private MdcContext() {}

    public static void setSession(String sessionId, String taskId) {
        MDC.put(SESSION_ID, sessionId);
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
    }

    public static void setNode(String node) {
        MDC.put(NODE, node);
    }

    public static void clearNode() {
        MDC.remove(NODE);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(NODE);
    }
}
