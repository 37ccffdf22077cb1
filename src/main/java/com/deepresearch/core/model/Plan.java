package com.deepresearch.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * A structured research plan produced by the planner for one iteration.
 * <p>
 * Plans are immutable. Recording a step result produces a new instance via
 * {@link #withStep(int, Step)}; re-planning replaces the plan entirely.
 *
 * @param title            plan title
 * @param thought          the planner's rationale
 * @param steps            ordered steps
 * @param hasEnoughContext true when no further planning is expected to change the report
 * @param locale           research locale, e.g. en-US
 */
public record Plan(
    String title,
    String thought,
    List<Step> steps,
    boolean hasEnoughContext,
    String locale
) implements Serializable {

    public Plan {
        steps = steps != null ? List.copyOf(steps) : List.of();
        title = title != null ? title : "";
        thought = thought != null ? thought : "";
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int totalSteps() {
        return steps.size();
    }

    /**
     * Index of the first PENDING step, if any.
     */
    public Optional<Integer> nextPendingIndex() {
        return IntStream.range(0, steps.size())
                .filter(i -> steps.get(i).status() == StepStatus.PENDING)
                .boxed()
                .findFirst();
    }

    public List<Step> pendingSteps() {
        return steps.stream().filter(s -> s.status() == StepStatus.PENDING).toList();
    }

    public List<Step> completedSteps() {
        return steps.stream().filter(s -> s.status() == StepStatus.COMPLETED).toList();
    }

    public Plan withStep(int index, Step step) {
        var updated = new ArrayList<>(steps);
        updated.set(index, step);
        return new Plan(title, thought, updated, hasEnoughContext, locale);
    }

    /**
     * Copy of this plan with every step back in PENDING, for plans edited by a caller.
     */
    public Plan withStepsReset() {
        return new Plan(title, thought, steps.stream().map(Step::reset).toList(), hasEnoughContext, locale);
    }
}
