package com.deepresearch.core.engine;

import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.StepFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Defaults for research sessions and sizing of the session worker pool.
 * Request values override the defaults per session.
 */
@Component
@ConfigurationProperties(prefix = "deepresearch.research")
public class ResearchProperties {

    private int maxStepNum = ResearchConfig.DEFAULT_MAX_STEP_NUM;
    private int maxPlanIterations = ResearchConfig.DEFAULT_MAX_PLAN_ITERATIONS;
    private boolean enableClarification = true;
    private boolean enableBackgroundInvestigation = true;
    private boolean autoAcceptPlan = true;
    private String reportStyle = ResearchConfig.DEFAULT_REPORT_STYLE;
    private String locale = ResearchConfig.DEFAULT_LOCALE;
    private int maxClarificationRounds = ResearchConfig.DEFAULT_MAX_CLARIFICATION_ROUNDS;
    private boolean abortOnStepFailure = false;
    private int maxStepRetries = 0;
    /** Session deadline in seconds; 0 disables it. */
    private long timeoutSeconds = 0;
    private int workerThreads = 4;
    /** Finished sessions kept for lookups before the oldest are evicted. */
    private int maxRetainedSessions = 500;
    /** Longest the blocking research endpoint waits before answering with the session id. */
    private long syncTimeoutSeconds = 600;

    /**
     * Builds the default configuration for a new session.
     */
    public ResearchConfig toConfig() {
        return new ResearchConfig(maxStepNum, maxPlanIterations, enableClarification, enableBackgroundInvestigation,
                autoAcceptPlan, reportStyle, locale, maxClarificationRounds,
                abortOnStepFailure ? StepFailurePolicy.ABORT : StepFailurePolicy.CONTINUE,
                maxStepRetries, timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null);
    }

    public int getMaxStepNum() {
        return maxStepNum;
    }

    public void setMaxStepNum(int maxStepNum) {
        this.maxStepNum = maxStepNum;
    }

    public int getMaxPlanIterations() {
        return maxPlanIterations;
    }

    public void setMaxPlanIterations(int maxPlanIterations) {
        this.maxPlanIterations = maxPlanIterations;
    }

    public boolean isEnableClarification() {
        return enableClarification;
    }

    public void setEnableClarification(boolean enableClarification) {
        this.enableClarification = enableClarification;
    }

    public boolean isEnableBackgroundInvestigation() {
        return enableBackgroundInvestigation;
    }

    public void setEnableBackgroundInvestigation(boolean enableBackgroundInvestigation) {
        this.enableBackgroundInvestigation = enableBackgroundInvestigation;
    }

    public boolean isAutoAcceptPlan() {
        return autoAcceptPlan;
    }

    public void setAutoAcceptPlan(boolean autoAcceptPlan) {
        this.autoAcceptPlan = autoAcceptPlan;
    }

    public String getReportStyle() {
        return reportStyle;
    }

    public void setReportStyle(String reportStyle) {
        this.reportStyle = reportStyle;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public int getMaxClarificationRounds() {
        return maxClarificationRounds;
    }

    public void setMaxClarificationRounds(int maxClarificationRounds) {
        this.maxClarificationRounds = maxClarificationRounds;
    }

    public boolean isAbortOnStepFailure() {
        return abortOnStepFailure;
    }

    public void setAbortOnStepFailure(boolean abortOnStepFailure) {
        this.abortOnStepFailure = abortOnStepFailure;
    }

    public int getMaxStepRetries() {
        return maxStepRetries;
    }

    public void setMaxStepRetries(int maxStepRetries) {
        this.maxStepRetries = maxStepRetries;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getMaxRetainedSessions() {
        return maxRetainedSessions;
    }

    public void setMaxRetainedSessions(int maxRetainedSessions) {
        this.maxRetainedSessions = maxRetainedSessions;
    }

    public long getSyncTimeoutSeconds() {
        return syncTimeoutSeconds;
    }

    public void setSyncTimeoutSeconds(long syncTimeoutSeconds) {
        this.syncTimeoutSeconds = syncTimeoutSeconds;
    }
}
