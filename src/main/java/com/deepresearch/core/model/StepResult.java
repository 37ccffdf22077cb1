package com.deepresearch.core.model;

import java.util.List;

/**
 * Outcome of executing a single step.
 *
 * @param status          COMPLETED or FAILED
 * @param executionResult summary of the findings, or an error summary
 * @param resources       sources discovered while executing
 */
public record StepResult(StepStatus status, String executionResult, List<Resource> resources) {

    public StepResult {
        if (status != StepStatus.COMPLETED && status != StepStatus.FAILED) {
            throw new IllegalArgumentException("StepResult status must be terminal, got " + status);
        }
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public static StepResult completed(String summary, List<Resource> resources) {
        return new StepResult(StepStatus.COMPLETED, summary, resources);
    }

    public static StepResult failed(String errorSummary) {
        return new StepResult(StepStatus.FAILED, errorSummary, List.of());
    }

    public boolean succeeded() {
        return status == StepStatus.COMPLETED;
    }
}
