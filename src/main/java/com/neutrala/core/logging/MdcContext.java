package com.neutrala.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing tracer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setStage(String sessionId, String stage) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(STAGE, stage);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(STAGE);
    }
}
