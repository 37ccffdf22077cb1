package com.deepresearch.core.model;

/**
 * States of the research workflow state machine.
 */
public enum ResearchStage {
    CLARIFYING,
    BACKGROUND_INVESTIGATING,
    PLANNING,
    AWAITING_PLAN_APPROVAL,
    EXECUTING_STEP,
    REPORTING,
    DONE,
    NEEDS_CLARIFICATION,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == NEEDS_CLARIFICATION || this == AWAITING_PLAN_APPROVAL
                || this == FAILED || this == CANCELLED;
    }
}
