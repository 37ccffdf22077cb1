package com.deepresearch.core.events;

import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchStage;

import java.time.Instant;
import java.util.List;

/**
 * A progress notification emitted whenever a research session enters a stage.
 *
 * @param researchId        the session this event belongs to
 * @param sequence          strictly increasing per research id; a resumed session continues the count
 * @param stage             stage the session has just entered
 * @param message           human-readable description of the stage
 * @param plan              the current plan, or null before planning
 * @param currentStepIndex  index of the step about to run (EXECUTING_STEP only)
 * @param totalSteps        step count of the current plan, or null before planning
 * @param observationsSoFar observation contents accumulated so far
 * @param timestamp         when the stage was entered
 */
public record ProgressEvent(
        String researchId,
        long sequence,
        ResearchStage stage,
        String message,
        Plan plan,
        Integer currentStepIndex,
        Integer totalSteps,
        List<String> observationsSoFar,
        Instant timestamp
) {

    public ProgressEvent {
        observationsSoFar = observationsSoFar != null ? List.copyOf(observationsSoFar) : List.of();
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
