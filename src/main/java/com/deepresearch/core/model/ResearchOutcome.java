package com.deepresearch.core.model;

/**
 * How a research session ended.
 */
public enum ResearchOutcome {
    DONE,
    NEEDS_CLARIFICATION,
    AWAITING_PLAN_APPROVAL,
    FAILED,
    CANCELLED;

    public static ResearchOutcome fromStage(ResearchStage stage) {
        return switch (stage) {
            case DONE -> DONE;
            case NEEDS_CLARIFICATION -> NEEDS_CLARIFICATION;
            case AWAITING_PLAN_APPROVAL -> AWAITING_PLAN_APPROVAL;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
            default -> throw new IllegalArgumentException("Stage " + stage + " is not terminal");
        };
    }
}
