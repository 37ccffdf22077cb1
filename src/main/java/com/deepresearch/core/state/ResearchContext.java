package com.deepresearch.core.state;

import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.ResearchOutcome;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.Step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Working state of one research session.
 * <p>
 * Owned by a single orchestrator run and never shared across sessions. The
 * research id is fixed at construction and correlates every progress event.
 */
public class ResearchContext {

    private final String researchId;
    private final String originalQuery;
    private final ResearchConfig config;
    private final List<ClarificationTurn> clarificationHistory;
    private final ObservationStore observations = new ObservationStore();
    private final ResourceRegistry resources = new ResourceRegistry();
    private final CancellationToken cancellation = new CancellationToken();

    private volatile String clarifiedQuery;
    private volatile Plan currentPlan;
    private volatile int planIterationCount;
    private volatile int stepsExecutedInCurrentPlan;
    private volatile int stepsDroppedFromCurrentPlan;
    private volatile int totalStepsExecuted;
    private volatile String pendingQuestion;
    private volatile String error;
    private volatile String finalReport;

    public ResearchContext(String researchId, String originalQuery, ResearchConfig config,
                           List<ClarificationTurn> clarificationHistory) {
        this.researchId = Objects.requireNonNull(researchId, "researchId");
        this.originalQuery = Objects.requireNonNull(originalQuery, "originalQuery");
        this.config = Objects.requireNonNull(config, "config");
        this.clarificationHistory = clarificationHistory != null ? List.copyOf(clarificationHistory) : List.of();
    }

    public String researchId() {
        return researchId;
    }

    public String originalQuery() {
        return originalQuery;
    }

    public ResearchConfig config() {
        return config;
    }

    public String locale() {
        return config.locale();
    }

    public List<ClarificationTurn> clarificationHistory() {
        return clarificationHistory;
    }

    public ObservationStore observations() {
        return observations;
    }

    public ResourceRegistry resources() {
        return resources;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Query used for planning: the clarified query once clarification has run,
     * the original query before that.
     */
    public String effectiveQuery() {
        String clarified = clarifiedQuery;
        return clarified != null && !clarified.isBlank() ? clarified : originalQuery;
    }

    public String clarifiedQuery() {
        return clarifiedQuery;
    }

    public void setClarifiedQuery(String clarifiedQuery) {
        this.clarifiedQuery = clarifiedQuery;
    }

    public Plan currentPlan() {
        return currentPlan;
    }

    public boolean hasPlan() {
        return currentPlan != null;
    }

    /**
     * Installs a freshly produced plan and resets the per-plan step budget.
     */
    public void replacePlan(Plan plan) {
        replacePlan(plan, 0);
    }

    /**
     * @param droppedSteps steps cut from the proposed plan to fit {@code maxStepNum}
     */
    public void replacePlan(Plan plan, int droppedSteps) {
        this.currentPlan = Objects.requireNonNull(plan, "plan");
        this.stepsExecutedInCurrentPlan = 0;
        this.stepsDroppedFromCurrentPlan = droppedSteps;
    }

    public void updateStep(int index, Step step) {
        Plan plan = currentPlan;
        if (plan == null) {
            throw new IllegalStateException("No plan to update in session " + researchId);
        }
        this.currentPlan = plan.withStep(index, step);
    }

    /**
     * Read-only view handed to the step executor for the step at {@code stepIndex}.
     */
    public StepContext stepContext(int stepIndex) {
        Plan plan = currentPlan;
        return new StepContext(researchId, effectiveQuery(), locale(), stepIndex, planIterationCount,
                observations.snapshot(), plan != null ? plan.completedSteps() : List.of());
    }

    public int planIterationCount() {
        return planIterationCount;
    }

    public int incrementPlanIteration() {
        return ++planIterationCount;
    }

    public int stepsExecutedInCurrentPlan() {
        return stepsExecutedInCurrentPlan;
    }

    public int stepsDroppedFromCurrentPlan() {
        return stepsDroppedFromCurrentPlan;
    }

    public int totalStepsExecuted() {
        return totalStepsExecuted;
    }

    public void recordStepExecuted() {
        stepsExecutedInCurrentPlan++;
        totalStepsExecuted++;
    }

    public String pendingQuestion() {
        return pendingQuestion;
    }

    public void setPendingQuestion(String pendingQuestion) {
        this.pendingQuestion = pendingQuestion;
    }

    public String error() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String finalReport() {
        return finalReport;
    }

    public void setFinalReport(String finalReport) {
        this.finalReport = finalReport;
    }

    /**
     * Builds the terminal result for this session. The report is only kept for DONE,
     * the question only for NEEDS_CLARIFICATION and the error only for FAILED/CANCELLED.
     */
    public ResearchResult toResult(ResearchOutcome outcome) {
        return new ResearchResult(
                researchId,
                outcome,
                originalQuery,
                clarifiedQuery,
                currentPlan,
                outcome == ResearchOutcome.DONE ? finalReport : null,
                outcome == ResearchOutcome.NEEDS_CLARIFICATION ? pendingQuestion : null,
                outcome == ResearchOutcome.FAILED || outcome == ResearchOutcome.CANCELLED ? error : null,
                observations.snapshot(),
                resources.snapshot(),
                locale(),
                metadata());
    }

    private Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("max_step_num", config.maxStepNum());
        metadata.put("max_plan_iterations", config.maxPlanIterations());
        metadata.put("enable_clarification", config.enableClarification());
        metadata.put("enable_background_investigation", config.enableBackgroundInvestigation());
        metadata.put("auto_accept_plan", config.autoAcceptPlan());
        metadata.put("report_style", config.resolvedReportStyle().tag());
        metadata.put("step_failure_policy", config.stepFailurePolicy().name());
        metadata.put("plan_iterations", planIterationCount);
        metadata.put("steps_executed", totalStepsExecuted);
        metadata.put("clarification_rounds", clarificationHistory.size());
        return metadata;
    }
}
