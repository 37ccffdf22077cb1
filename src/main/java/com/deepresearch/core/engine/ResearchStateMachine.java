package com.deepresearch.core.engine;

import com.deepresearch.core.agents.BackgroundInvestigator;
import com.deepresearch.core.agents.Clarifier;
import com.deepresearch.core.agents.PlanRequest;
import com.deepresearch.core.agents.Planner;
import com.deepresearch.core.agents.Reporter;
import com.deepresearch.core.agents.StepExecutor;
import com.deepresearch.core.logging.MdcContext;
import com.deepresearch.core.metrics.ResearchMetrics;
import com.deepresearch.core.model.BackgroundFindings;
import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.ClarifyOutcome;
import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchStage;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepFailurePolicy;
import com.deepresearch.core.model.StepResult;
import com.deepresearch.core.model.StepStatus;
import com.deepresearch.core.state.ResearchContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The research workflow as an explicit finite-state machine.
 * <p>
 * {@link #next(ResearchStage, ResearchContext)} performs the collaborator call that
 * belongs to the current stage, records its effects in the context and returns the
 * following stage. Terminal stages have no successor.
 * <p>
 * Budgets: the planner runs at most {@code maxPlanIterations} times per session and at
 * most {@code maxStepNum} steps run per plan, failed steps included.
 */
@Component
public class ResearchStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ResearchStateMachine.class);

    private final Clarifier clarifier;
    private final BackgroundInvestigator backgroundInvestigator;
    private final Planner planner;
    private final StepExecutor stepExecutor;
    private final Reporter reporter;
    private final ResearchMetrics metrics;

    public ResearchStateMachine(Clarifier clarifier, BackgroundInvestigator backgroundInvestigator,
                                Planner planner, StepExecutor stepExecutor, Reporter reporter,
                                ResearchMetrics metrics) {
        this.clarifier = clarifier;
        this.backgroundInvestigator = backgroundInvestigator;
        this.planner = planner;
        this.stepExecutor = stepExecutor;
        this.reporter = reporter;
        this.metrics = metrics;
    }

    /**
     * First stage of a fresh session.
     */
    public ResearchStage initialStage(ResearchConfig config) {
        if (config.enableClarification()) {
            return ResearchStage.CLARIFYING;
        }
        return afterClarification(config);
    }

    /**
     * Runs the current stage and returns the next one.
     *
     * @throws CollaboratorException if the clarifier, planner or reporter fails
     * @throws IllegalStateException if {@code current} is terminal
     */
    public ResearchStage next(ResearchStage current, ResearchContext context) {
        return switch (current) {
            case CLARIFYING -> clarify(context);
            case BACKGROUND_INVESTIGATING -> investigate(context);
            case PLANNING -> plan(context);
            case EXECUTING_STEP -> executeStep(context);
            case REPORTING -> report(context);
            case AWAITING_PLAN_APPROVAL, DONE, NEEDS_CLARIFICATION, FAILED, CANCELLED ->
                    throw new IllegalStateException("Stage " + current + " is terminal");
        };
    }

    /**
     * Stage to continue at once a suspended plan has been approved.
     */
    public ResearchStage afterApproval(ResearchContext context) {
        Plan plan = context.currentPlan();
        if (plan == null || plan.isEmpty()) {
            return ResearchStage.REPORTING;
        }
        return ResearchStage.EXECUTING_STEP;
    }

    private ResearchStage clarify(ResearchContext context) {
        ResearchConfig config = context.config();
        var history = context.clarificationHistory();
        if (history.size() >= config.maxClarificationRounds()) {
            log.info("Clarification limit of {} round(s) reached, proceeding with the answers given",
                    config.maxClarificationRounds());
            context.setClarifiedQuery(ClarificationTurn.foldInto(context.originalQuery(), history));
            return afterClarification(config);
        }

        ClarifyOutcome outcome;
        try {
            outcome = clarifier.clarify(context.originalQuery(), history, config);
        } catch (RuntimeException e) {
            throw new CollaboratorException(ResearchStage.CLARIFYING, "Clarification failed: " + e.getMessage(), e);
        }
        if (context.cancellation().isCancelled()) {
            return ResearchStage.CANCELLED;
        }
        if (outcome == null) {
            throw new CollaboratorException(ResearchStage.CLARIFYING, "Clarifier returned no outcome", null);
        }
        if (outcome.needsMoreInput()) {
            context.setPendingQuestion(outcome.question());
            log.info("Clarification needed: {}", outcome.question());
            return ResearchStage.NEEDS_CLARIFICATION;
        }
        String clarified = outcome.clarifiedQuery();
        context.setClarifiedQuery(clarified != null && !clarified.isBlank()
                ? clarified
                : ClarificationTurn.foldInto(context.originalQuery(), history));
        return afterClarification(config);
    }

    private static ResearchStage afterClarification(ResearchConfig config) {
        return config.enableBackgroundInvestigation()
                ? ResearchStage.BACKGROUND_INVESTIGATING
                : ResearchStage.PLANNING;
    }

    private ResearchStage investigate(ResearchContext context) {
        try {
            BackgroundFindings findings = backgroundInvestigator.investigate(context.effectiveQuery(), context.config());
            if (findings != null) {
                context.observations().appendAll(findings.observations());
                context.resources().addAll(findings.resources());
                log.info("Background investigation added {} observation(s)", findings.observations().size());
            }
        } catch (RuntimeException e) {
            if (context.cancellation().isCancelled()) {
                return ResearchStage.CANCELLED;
            }
            metrics.incrementBackgroundFailures();
            log.warn("Background investigation failed, planning without it: {}", e.getMessage());
        }
        if (context.cancellation().isCancelled()) {
            return ResearchStage.CANCELLED;
        }
        return ResearchStage.PLANNING;
    }

    private ResearchStage plan(ResearchContext context) {
        ResearchConfig config = context.config();
        if (context.hasPlan() && context.planIterationCount() >= config.maxPlanIterations()) {
            log.info("Plan iteration budget of {} exhausted, moving to reporting", config.maxPlanIterations());
            return ResearchStage.REPORTING;
        }

        int iteration = context.incrementPlanIteration();
        var request = new PlanRequest(context.effectiveQuery(), context.observations().snapshot(),
                context.locale(), iteration, config.maxStepNum());
        long start = System.currentTimeMillis();
        Plan plan;
        try {
            plan = planner.plan(request);
        } catch (RuntimeException e) {
            throw new CollaboratorException(ResearchStage.PLANNING, "Planning failed: " + e.getMessage(), e);
        } finally {
            metrics.recordPlanningDuration(System.currentTimeMillis() - start);
        }
        if (context.cancellation().isCancelled()) {
            return ResearchStage.CANCELLED;
        }
        if (plan == null) {
            throw new CollaboratorException(ResearchStage.PLANNING, "Planner returned no plan", null);
        }

        plan = adopt(plan, context);
        log.info("Plan {} of {}: '{}' with {} step(s), hasEnoughContext={}", iteration, config.maxPlanIterations(),
                plan.title(), plan.totalSteps(), plan.hasEnoughContext());

        if (plan.isEmpty()) {
            return ResearchStage.REPORTING;
        }
        if (!config.autoAcceptPlan()) {
            return ResearchStage.AWAITING_PLAN_APPROVAL;
        }
        return ResearchStage.EXECUTING_STEP;
    }

    /**
     * Normalizes a planner or caller-edited plan and makes it the current plan,
     * remembering how many steps the budget cut off.
     */
    Plan adopt(Plan proposed, ResearchContext context) {
        Plan plan = normalize(proposed, context);
        context.replacePlan(plan, proposed.totalSteps() - plan.totalSteps());
        return plan;
    }

    /**
     * Guards the plan invariants: every step pending, at most {@code maxStepNum} steps, a locale set.
     */
    private Plan normalize(Plan plan, ResearchContext context) {
        int max = context.config().maxStepNum();
        var steps = plan.steps();
        if (steps.stream().anyMatch(s -> s.status() != StepStatus.PENDING)) {
            log.warn("Plan has steps that are not pending, resetting them");
            steps = steps.stream().map(Step::reset).toList();
        }
        if (steps.size() > max) {
            log.warn("Plan has {} steps, truncating to {}", steps.size(), max);
            steps = steps.subList(0, max);
        }
        String locale = plan.locale() != null && !plan.locale().isBlank() ? plan.locale() : context.locale();
        return new Plan(plan.title(), plan.thought(), steps, plan.hasEnoughContext(), locale);
    }

    private ResearchStage executeStep(ResearchContext context) {
        ResearchConfig config = context.config();
        Plan plan = context.currentPlan();
        Optional<Integer> pending = plan != null ? plan.nextPendingIndex() : Optional.empty();
        if (pending.isEmpty()) {
            return afterPlanExhausted(context);
        }
        if (context.stepsExecutedInCurrentPlan() >= config.maxStepNum()) {
            return stepBudgetExhausted(context);
        }

        int index = pending.get();
        Step running = plan.steps().get(index).start();
        context.updateStep(index, running);
        MdcContext.setStep(context.researchId(), index, running.stepType().name().toLowerCase());
        try {
            log.info("Executing step {}/{}: {}", index + 1, plan.totalSteps(), running.title());
            long start = System.currentTimeMillis();
            StepResult result = attempt(running, context, index);
            if (context.cancellation().isCancelled()) {
                // in-flight step stays RUNNING without a result
                return ResearchStage.CANCELLED;
            }
            context.recordStepExecuted();
            metrics.recordStepExecution(running.stepType().name(), result.status().name(),
                    System.currentTimeMillis() - start);

            int iteration = context.planIterationCount();
            if (result.succeeded()) {
                context.updateStep(index, running.complete(result.executionResult()));
                context.observations().append(Observation.stepResult(result.executionResult(), index, iteration));
                context.resources().addAll(result.resources());
                log.info("Step {} completed", index + 1);
            } else {
                String error = result.executionResult();
                context.updateStep(index, running.fail(error));
                context.observations().append(Observation.stepFailure(
                        "Step '" + running.title() + "' failed: " + error, index, iteration));
                if (config.stepFailurePolicy() == StepFailurePolicy.ABORT) {
                    context.setError("Step " + (index + 1) + " '" + running.title() + "' failed: " + error);
                    log.error("Step {} failed, aborting session: {}", index + 1, error);
                    return ResearchStage.FAILED;
                }
                log.warn("Step {} failed, continuing: {}", index + 1, error);
            }
        } finally {
            MdcContext.clearStep();
        }

        Plan updated = context.currentPlan();
        if (updated.nextPendingIndex().isEmpty()) {
            return afterPlanExhausted(context);
        }
        if (context.stepsExecutedInCurrentPlan() >= config.maxStepNum()) {
            return stepBudgetExhausted(context);
        }
        return ResearchStage.EXECUTING_STEP;
    }

    /**
     * Steps remain but the per-plan step budget is spent, so report what was gathered.
     */
    private ResearchStage stepBudgetExhausted(ResearchContext context) {
        log.info("Step budget of {} exhausted with {} step(s) left undone, moving to reporting",
                context.config().maxStepNum(),
                context.currentPlan().pendingSteps().size() + context.stepsDroppedFromCurrentPlan());
        return ResearchStage.REPORTING;
    }

    /**
     * Calls the executor up to {@code 1 + maxStepRetries} times. The step stays RUNNING
     * in between; only the last attempt counts.
     */
    private StepResult attempt(Step running, ResearchContext context, int index) {
        int attempts = 1 + context.config().maxStepRetries();
        StepResult result = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                result = stepExecutor.execute(running, context.stepContext(index));
            } catch (RuntimeException e) {
                result = StepResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result == null) {
                result = StepResult.failed("Executor returned no result");
            }
            if (result.succeeded() || context.cancellation().isCancelled()) {
                return result;
            }
            if (attempt < attempts) {
                log.warn("Step {} attempt {}/{} failed, retrying: {}", index + 1, attempt, attempts,
                        result.executionResult());
            }
        }
        return result;
    }

    private ResearchStage afterPlanExhausted(ResearchContext context) {
        Plan plan = context.currentPlan();
        ResearchConfig config = context.config();
        if (plan != null && plan.hasEnoughContext()) {
            return ResearchStage.REPORTING;
        }
        if (context.stepsDroppedFromCurrentPlan() > 0) {
            return stepBudgetExhausted(context);
        }
        if (context.planIterationCount() < config.maxPlanIterations()) {
            log.info("Plan {} finished without enough context, re-planning", context.planIterationCount());
            return ResearchStage.PLANNING;
        }
        log.info("Plan iteration budget of {} exhausted, moving to reporting", config.maxPlanIterations());
        return ResearchStage.REPORTING;
    }

    private ResearchStage report(ResearchContext context) {
        String report;
        try {
            report = reporter.report(context.effectiveQuery(), context.currentPlan(),
                    context.observations().snapshot(), context.resources().snapshot(),
                    context.config().resolvedReportStyle(), context.locale());
        } catch (RuntimeException e) {
            throw new CollaboratorException(ResearchStage.REPORTING, "Reporting failed: " + e.getMessage(), e);
        }
        if (context.cancellation().isCancelled()) {
            return ResearchStage.CANCELLED;
        }
        context.setFinalReport(report != null ? report : "");
        return ResearchStage.DONE;
    }
}
