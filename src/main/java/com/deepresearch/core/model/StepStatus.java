package com.deepresearch.core.model;

/**
 * Status of a single step within a research plan.
 * <p>
 * Transitions: PENDING -> RUNNING -> COMPLETED | FAILED.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
