package com.deepresearch.core.agents;

import com.deepresearch.core.model.Observation;

import java.util.List;

/**
 * Inputs for one planner invocation.
 *
 * @param query        the clarified query
 * @param observations every observation gathered so far, in store order
 * @param locale       research locale
 * @param iteration    1-based planning iteration
 * @param maxStepNum   upper bound on the number of steps the plan may contain
 */
public record PlanRequest(
    String query,
    List<Observation> observations,
    String locale,
    int iteration,
    int maxStepNum
) {

    public PlanRequest {
        observations = observations != null ? List.copyOf(observations) : List.of();
    }
}
