package com.deepresearch.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of a research session. Partial state (plan, observations,
 * resources) is kept for every outcome.
 *
 * @param researchId     session correlation id
 * @param outcome        terminal outcome
 * @param query          the caller's original query
 * @param clarifiedQuery the query actually planned against; null if planning never started
 * @param plan           the last plan, or null if none was produced
 * @param finalReport    rendered report; set only for DONE
 * @param question       clarification question; set only for NEEDS_CLARIFICATION
 * @param error          error or cancellation summary; set for FAILED and CANCELLED
 * @param observations   every observation accumulated in the session, in order
 * @param resources      deduplicated resources
 * @param locale         research locale
 * @param metadata       configuration echo and counters
 */
public record ResearchResult(
    String researchId,
    ResearchOutcome outcome,
    String query,
    String clarifiedQuery,
    Plan plan,
    String finalReport,
    String question,
    String error,
    List<Observation> observations,
    List<Resource> resources,
    String locale,
    Map<String, Object> metadata
) implements Serializable {

    public ResearchResult {
        observations = observations != null ? List.copyOf(observations) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public List<String> observationContents() {
        return observations.stream().map(Observation::content).toList();
    }
}
