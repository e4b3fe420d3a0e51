package com.swissknife.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Swissknife-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TOOL = "tool";
    public static final String EXECUTION_ID = "executionId";

    private MdcContext() {}

    public static void setTool(String tool) {
        MDC.put(TOOL, tool);
    }

    public static void setExecution(String tool, String executionId) {
        MDC.put(TOOL, tool);
        MDC.put(EXECUTION_ID, executionId);
    }

    public static void clear() {
        MDC.remove(TOOL);
        MDC.remove(EXECUTION_ID);
    }
}
