package com.deepresearch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One unit of work within a {@link Plan}.
 * <p>
 * {@code description}, {@code stepType} and {@code needSearch} are fixed when the
 * planner creates the step. Only {@code status} and {@code executionResult} change,
 * and only through {@link #start()}, {@link #complete(String)} and {@link #fail(String)}.
 *
 * @param title           short step title
 * @param description     what the executing agent should find out or compute
 * @param stepType        research or processing
 * @param needSearch      whether a research step may use web-search tools
 * @param status          current status
 * @param executionResult summary or error text; non-null iff status is terminal
 */
public record Step(
    String title,
    String description,
    StepType stepType,
    boolean needSearch,
    StepStatus status,
    String executionResult
) implements Serializable {

    public Step {
        Objects.requireNonNull(status, "status");
        stepType = stepType != null ? stepType : StepType.RESEARCH;
        if (status.isTerminal() && executionResult == null) {
            throw new IllegalArgumentException("Step in status " + status + " requires an execution result");
        }
        if (!status.isTerminal() && executionResult != null) {
            throw new IllegalArgumentException("Step in status " + status + " cannot carry an execution result");
        }
    }

    public static Step pending(String title, String description, StepType stepType, boolean needSearch) {
        return new Step(title, description, stepType, needSearch, StepStatus.PENDING, null);
    }

    public Step start() {
        requireStatus(StepStatus.PENDING, StepStatus.RUNNING);
        return new Step(title, description, stepType, needSearch, StepStatus.RUNNING, null);
    }

    public Step complete(String result) {
        requireStatus(StepStatus.RUNNING, StepStatus.COMPLETED);
        return new Step(title, description, stepType, needSearch, StepStatus.COMPLETED,
                result != null ? result : "");
    }

    public Step fail(String errorSummary) {
        requireStatus(StepStatus.RUNNING, StepStatus.FAILED);
        return new Step(title, description, stepType, needSearch, StepStatus.FAILED,
                errorSummary != null ? errorSummary : "Step failed");
    }

    /**
     * Returns a PENDING copy of this step with the same content. Used when a caller
     * edits a plan before approving it.
     */
    public Step reset() {
        return pending(title, description, stepType, needSearch);
    }

    private void requireStatus(StepStatus expected, StepStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Illegal step transition " + status + " -> " + target + " for step '" + title + "'");
        }
    }
}
