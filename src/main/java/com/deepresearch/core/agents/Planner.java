package com.deepresearch.core.agents;

import com.deepresearch.core.model.Plan;

/**
 * Produces a research plan. Every step of the returned plan is PENDING and the
 * plan never holds more than {@link PlanRequest#maxStepNum()} steps.
 */
public interface Planner {

    Plan plan(PlanRequest request);
}
