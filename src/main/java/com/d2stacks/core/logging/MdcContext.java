package com.d2stacks.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing d2stacks MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEndpoint(int endpointId) {
        MDC.put("endpointId", String.valueOf(endpointId));
    }

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setOperation(String operation, int endpointId) {
        setOperation(operation);
        setEndpoint(endpointId);
    }

    public static void clear() {
        MDC.remove("endpointId");
        MDC.remove("operation");
    }
}
