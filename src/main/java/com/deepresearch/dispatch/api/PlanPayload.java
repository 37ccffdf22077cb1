package com.deepresearch.dispatch.api;

import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON shape of a plan, used in responses, progress events and plan edits.
 */
public record PlanPayload(
    String title,
    String thought,
    List<StepPayload> steps,
    @JsonProperty("has_enough_context") boolean hasEnoughContext,
    String locale
) {

    public record StepPayload(
        String title,
        String description,
        @JsonProperty("step_type") String stepType,
        @JsonProperty("need_search") boolean needSearch,
        String status,
        @JsonProperty("execution_result") String executionResult
    ) {}

    public static PlanPayload from(Plan plan) {
        if (plan == null) {
            return null;
        }
        List<StepPayload> steps = plan.steps().stream()
                .map(s -> new StepPayload(s.title(), s.description(), s.stepType().name().toLowerCase(),
                        s.needSearch(), s.status().name().toLowerCase(), s.executionResult()))
                .toList();
        return new PlanPayload(plan.title(), plan.thought(), steps, plan.hasEnoughContext(), plan.locale());
    }

    /**
     * Converts an edited plan back to the domain model. Status and results sent by the
     * caller are ignored; every step starts pending.
     */
    public Plan toPlan() {
        List<Step> converted = steps == null ? List.of() : steps.stream()
                .filter(s -> s != null && s.title() != null && !s.title().isBlank())
                .map(s -> Step.pending(s.title(), s.description() != null ? s.description() : "",
                        StepType.from(s.stepType()), s.needSearch()))
                .toList();
        return new Plan(title, thought, converted, hasEnoughContext, locale);
    }
}
