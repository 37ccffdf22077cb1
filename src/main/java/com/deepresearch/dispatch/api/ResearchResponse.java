package com.deepresearch.dispatch.api;

import com.deepresearch.core.engine.ResearchSession;
import com.deepresearch.core.model.ResearchResult;
import com.deepresearch.core.model.Resource;
import com.deepresearch.core.state.ResearchContext;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON response for research sessions. {@code status} is the outcome once the session
 * has finished and the current stage while it is running.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResearchResponse(
    @JsonProperty("research_id") String researchId,
    String status,
    boolean finished,
    String query,
    @JsonProperty("clarified_query") String clarifiedQuery,
    PlanPayload plan,
    @JsonProperty("final_report") String finalReport,
    String question,
    String error,
    List<String> observations,
    List<Resource> resources,
    String locale,
    Map<String, Object> metadata
) {

    public static ResearchResponse from(ResearchResult result) {
        return new ResearchResponse(
                result.researchId(),
                result.outcome().name(),
                true,
                result.query(),
                result.clarifiedQuery(),
                PlanPayload.from(result.plan()),
                result.finalReport(),
                result.question(),
                result.error(),
                result.observationContents(),
                result.resources(),
                result.locale(),
                result.metadata());
    }

    /**
     * Terminal result if the session has finished, otherwise a live snapshot.
     */
    public static ResearchResponse from(ResearchSession session) {
        return session.result()
                .map(ResearchResponse::from)
                .orElseGet(() -> running(session));
    }

    private static ResearchResponse running(ResearchSession session) {
        ResearchContext context = session.context();
        return new ResearchResponse(
                context.researchId(),
                session.stage().name(),
                false,
                context.originalQuery(),
                context.clarifiedQuery(),
                PlanPayload.from(context.currentPlan()),
                null,
                null,
                null,
                context.observations().contents(),
                context.resources().snapshot(),
                context.locale(),
                null);
    }
}
