package com.deepresearch.core.model;

/**
 * Caller decision on a plan that is awaiting approval.
 *
 * @param approved   true to execute the plan
 * @param editedPlan replacement plan supplied by the caller; null keeps the planner's plan
 */
public record PlanApproval(boolean approved, Plan editedPlan) {

    public static PlanApproval accept() {
        return new PlanApproval(true, null);
    }

    public static PlanApproval acceptEdited(Plan plan) {
        return new PlanApproval(true, plan);
    }

    public static PlanApproval reject() {
        return new PlanApproval(false, null);
    }
}
