package com.deepresearch.dispatch.api;

import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.StepFailurePolicy;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Inbound JSON body for the research endpoints. Every field except {@code query}
 * is optional and falls back to the {@code deepresearch.research.*} defaults.
 */
public record ResearchRequest(
    String query,
    @JsonProperty("max_step_num") Integer maxStepNum,
    @JsonProperty("max_plan_iterations") Integer maxPlanIterations,
    @JsonProperty("enable_clarification") Boolean enableClarification,
    @JsonProperty("enable_background_investigation") Boolean enableBackgroundInvestigation,
    @JsonProperty("auto_accept_plan") Boolean autoAcceptPlan,
    @JsonProperty("report_style") String reportStyle,
    String locale,
    @JsonProperty("max_clarification_rounds") Integer maxClarificationRounds,
    @JsonProperty("abort_on_step_failure") Boolean abortOnStepFailure,
    @JsonProperty("max_step_retries") Integer maxStepRetries,
    @JsonProperty("timeout_seconds") Long timeoutSeconds
) {

    public static ResearchRequest of(String query) {
        return new ResearchRequest(query, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Overlays the values present in this request on the given defaults.
     */
    public ResearchConfig toConfig(ResearchConfig defaults) {
        ResearchConfig config = defaults;
        if (maxStepNum != null) config = config.withMaxStepNum(maxStepNum);
        if (maxPlanIterations != null) config = config.withMaxPlanIterations(maxPlanIterations);
        if (enableClarification != null) config = config.withClarification(enableClarification);
        if (enableBackgroundInvestigation != null) config = config.withBackgroundInvestigation(enableBackgroundInvestigation);
        if (autoAcceptPlan != null) config = config.withAutoAcceptPlan(autoAcceptPlan);
        if (reportStyle != null) config = config.withReportStyle(reportStyle);
        if (locale != null) config = config.withLocale(locale);
        if (maxClarificationRounds != null) config = config.withMaxClarificationRounds(maxClarificationRounds);
        if (abortOnStepFailure != null) {
            config = config.withStepFailurePolicy(abortOnStepFailure ? StepFailurePolicy.ABORT : StepFailurePolicy.CONTINUE);
        }
        if (maxStepRetries != null) config = config.withMaxStepRetries(maxStepRetries);
        // zero or negative is passed through so validation can reject it
        if (timeoutSeconds != null) config = config.withTimeout(Duration.ofSeconds(timeoutSeconds));
        return config;
    }
}
