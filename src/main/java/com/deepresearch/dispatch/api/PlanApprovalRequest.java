package com.deepresearch.dispatch.api;

import com.deepresearch.core.model.PlanApproval;

/**
 * Inbound JSON body for POST /api/v1/research/sessions/{id}/approve.
 *
 * @param approved false rejects the plan and cancels the session; null means approve
 * @param plan     optional edited plan replacing the proposed one
 */
public record PlanApprovalRequest(
    Boolean approved,
    PlanPayload plan
) {

    public PlanApproval toApproval() {
        if (approved != null && !approved) {
            return PlanApproval.reject();
        }
        return plan != null ? PlanApproval.acceptEdited(plan.toPlan()) : PlanApproval.accept();
    }
}
