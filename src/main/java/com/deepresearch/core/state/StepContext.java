package com.deepresearch.core.state;

import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Step;

import java.util.List;

/**
 * Read-only view of the session handed to a step executor.
 *
 * @param researchId     session id
 * @param query          clarified query
 * @param locale         research locale
 * @param stepIndex      index of the step in the current plan
 * @param planIteration  current plan iteration (1-based)
 * @param observations   every observation made so far
 * @param completedSteps steps of the current plan already completed, in order
 */
public record StepContext(
    String researchId,
    String query,
    String locale,
    int stepIndex,
    int planIteration,
    List<Observation> observations,
    List<Step> completedSteps
) {

    public StepContext {
        observations = observations != null ? List.copyOf(observations) : List.of();
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
    }
}
