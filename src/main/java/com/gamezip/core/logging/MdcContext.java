package com.gamezip.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing gamezip-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put("requestId", requestId);
    }

    public static void setMount(String mountId) {
        MDC.put("mountId", mountId);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("mountId");
    }
}
