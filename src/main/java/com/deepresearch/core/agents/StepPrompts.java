package com.deepresearch.core.agents;

import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.state.StepContext;

/**
 * Shared user-prompt layout for the step agents.
 */
final class StepPrompts {

    /** Observations beyond this many characters are cut in prompts. */
    static final int MAX_OBSERVATION_CHARS = 2_000;

    private StepPrompts() {}

    static String forStep(Step step, StepContext context) {
        var sb = new StringBuilder();
        sb.append(String.format("""
                Locale: %s
                Research question: %s

                Current step: %s
                %s
                """,
                context.locale(), context.query(), step.title(), step.description()));

        if (!context.completedSteps().isEmpty()) {
            sb.append("\nCompleted steps:\n");
            for (Step done : context.completedSteps()) {
                sb.append("- ").append(done.title()).append("\n");
            }
        }
        if (!context.observations().isEmpty()) {
            sb.append("\nFindings so far:\n");
            for (Observation o : context.observations()) {
                sb.append("- ").append(truncate(o.content())).append("\n");
            }
        }
        return sb.toString();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_OBSERVATION_CHARS) {
            return text;
        }
        return text.substring(0, MAX_OBSERVATION_CHARS) + " ...";
    }
}
