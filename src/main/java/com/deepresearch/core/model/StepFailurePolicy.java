package com.deepresearch.core.model;

/**
 * What the orchestrator does once a step has failed and its retries are used up.
 */
public enum StepFailurePolicy {
    /** Record the failure as an observation and move on to the next step. */
    CONTINUE,
    /** Record the failure and end the session as FAILED. */
    ABORT
}
