package com.deepresearch.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Immutable configuration snapshot for one research session.
 *
 * @param maxStepNum             maximum steps executed per plan
 * @param maxPlanIterations      maximum number of plans generated per session
 * @param enableClarification    run the coordinator before planning
 * @param enableBackgroundInvestigation run a quick search before the first plan
 * @param autoAcceptPlan         execute plans without waiting for caller approval
 * @param reportStyle            report style tag; unknown tags render as academic
 * @param locale                 research locale
 * @param maxClarificationRounds clarification questions asked before proceeding regardless
 * @param stepFailurePolicy      continue or abort after a failed step
 * @param maxStepRetries         additional attempts for a failing step
 * @param timeout                session deadline; null for none
 */
public record ResearchConfig(
    int maxStepNum,
    int maxPlanIterations,
    boolean enableClarification,
    boolean enableBackgroundInvestigation,
    boolean autoAcceptPlan,
    String reportStyle,
    String locale,
    int maxClarificationRounds,
    StepFailurePolicy stepFailurePolicy,
    int maxStepRetries,
    Duration timeout
) implements Serializable {

    public static final int DEFAULT_MAX_STEP_NUM = 5;
    public static final int DEFAULT_MAX_PLAN_ITERATIONS = 1;
    public static final String DEFAULT_REPORT_STYLE = "academic";
    public static final String DEFAULT_LOCALE = "en-US";
    public static final int DEFAULT_MAX_CLARIFICATION_ROUNDS = 3;

    public ResearchConfig {
        reportStyle = reportStyle != null ? reportStyle : DEFAULT_REPORT_STYLE;
        stepFailurePolicy = stepFailurePolicy != null ? stepFailurePolicy : StepFailurePolicy.CONTINUE;
    }

    public static ResearchConfig defaults() {
        return new ResearchConfig(DEFAULT_MAX_STEP_NUM, DEFAULT_MAX_PLAN_ITERATIONS, true, true, true,
                DEFAULT_REPORT_STYLE, DEFAULT_LOCALE, DEFAULT_MAX_CLARIFICATION_ROUNDS,
                StepFailurePolicy.CONTINUE, 0, null);
    }

    public ResearchConfig withMaxStepNum(int value) {
        return new ResearchConfig(value, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withMaxPlanIterations(int value) {
        return new ResearchConfig(maxStepNum, value, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withClarification(boolean value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, value, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withBackgroundInvestigation(boolean value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, value,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withAutoAcceptPlan(boolean value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                value, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withReportStyle(String value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, value, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withLocale(String value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, value, maxClarificationRounds, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withMaxClarificationRounds(int value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, value, stepFailurePolicy, maxStepRetries, timeout);
    }

    public ResearchConfig withStepFailurePolicy(StepFailurePolicy value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, value, maxStepRetries, timeout);
    }

    public ResearchConfig withMaxStepRetries(int value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, value, timeout);
    }

    public ResearchConfig withTimeout(Duration value) {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds, stepFailurePolicy, maxStepRetries, value);
    }

    public ReportStyle resolvedReportStyle() {
        return ReportStyle.from(reportStyle);
    }

    /**
     * Checks the configuration together with the query it will be used for.
     *
     * @throws ResearchConfigurationException if anything is out of range
     */
    public void validate(String query) {
        if (query == null || query.isBlank()) {
            throw new ResearchConfigurationException("Query is required");
        }
        if (maxStepNum < 1) {
            throw new ResearchConfigurationException("max_step_num must be at least 1, got " + maxStepNum);
        }
        if (maxPlanIterations < 1) {
            throw new ResearchConfigurationException(
                    "max_plan_iterations must be at least 1, got " + maxPlanIterations);
        }
        if (maxClarificationRounds < 0) {
            throw new ResearchConfigurationException(
                    "max_clarification_rounds must not be negative, got " + maxClarificationRounds);
        }
        if (maxStepRetries < 0) {
            throw new ResearchConfigurationException("max_step_retries must not be negative, got " + maxStepRetries);
        }
        if (locale == null || locale.isBlank()) {
            throw new ResearchConfigurationException("locale is required");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new ResearchConfigurationException("timeout must be positive, got " + timeout);
        }
    }
}
