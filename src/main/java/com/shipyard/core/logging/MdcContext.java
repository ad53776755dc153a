package com.shipyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing pipeline MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String PIPELINE = "pipeline";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRun(String runId, String pipeline) {
        MDC.put(RUN_ID, runId);
        MDC.put(PIPELINE, pipeline);
    }

    public static void setStage(String runId, String pipeline, String stageName) {
        MDC.put(RUN_ID, runId);
        MDC.put(PIPELINE, pipeline);
        MDC.put(STAGE, stageName);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(PIPELINE);
        MDC.remove(STAGE);
    }
}
