package com.deepresearch.core.agents;

import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepResult;
import com.deepresearch.core.state.StepContext;

/**
 * Executes a single plan step. Implementations report failure through
 * {@link StepResult#failed(String)} rather than by throwing, and never retry.
 */
public interface StepExecutor {

    StepResult execute(Step step, StepContext context);
}
