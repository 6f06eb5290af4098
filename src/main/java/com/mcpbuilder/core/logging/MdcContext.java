package com.mcpbuilder.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing realtime-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConnection(String connectionId, String userId) {
        MDC.put("connectionId", connectionId);
        MDC.put("userId", userId);
    }

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
    }

    public static void clear() {
        MDC.remove("connectionId");
        MDC.remove("userId");
        MDC.remove("projectId");
    }
}
