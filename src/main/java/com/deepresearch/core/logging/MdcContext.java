package com.deepresearch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing research-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RESEARCH_ID = "researchId";
    public static final String STAGE = "stage";
    public static final String STEP_INDEX = "stepIndex";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setResearch(String researchId) {
        MDC.put(RESEARCH_ID, researchId);
    }

    public static void setStage(String researchId, String stage) {
        MDC.put(RESEARCH_ID, researchId);
        MDC.put(STAGE, stage);
    }

    public static void setStep(String researchId, int stepIndex, String agent) {
        MDC.put(RESEARCH_ID, researchId);
        MDC.put(STEP_INDEX, String.valueOf(stepIndex));
        MDC.put(AGENT, agent);
    }

    public static void clearStep() {
        MDC.remove(STEP_INDEX);
        MDC.remove(AGENT);
    }

    public static void clear() {
        MDC.remove(RESEARCH_ID);
        MDC.remove(STAGE);
        MDC.remove(STEP_INDEX);
        MDC.remove(AGENT);
    }
}
