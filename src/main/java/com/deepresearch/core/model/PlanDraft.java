package com.deepresearch.core.model;

import java.util.List;

/**
 * Structured output from the LLM representing a proposed research plan.
 * <p>
 * Drafts are untrusted: the planner validates them and converts each
 * {@link StepDraft} into a pending {@link Step}.
 *
 * @param title            short plan title
 * @param thought          the planner's rationale
 * @param hasEnoughContext true when the gathered information already answers the query
 * @param steps            ordered steps to execute
 */
public record PlanDraft(
    String title,
    String thought,
    boolean hasEnoughContext,
    List<StepDraft> steps
) {

    /**
     * A single proposed step.
     *
     * @param title       short step title
     * @param description what the step should find out or compute
     * @param stepType    "research" or "processing"
     * @param needSearch  whether the step needs web search tools
     */
    public record StepDraft(
        String title,
        String description,
        String stepType,
        boolean needSearch
    ) {}
}
