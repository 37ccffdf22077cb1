package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.PlanDraft;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM-backed {@link Planner}.
 * <p>
 * Uses {@link LlmService#structuredCall} to obtain a {@link PlanDraft} and converts
 * it into a {@link Plan}: steps without a title are dropped, unknown step types
 * become research steps, and steps beyond the budget are cut off.
 */
@Component
public class PlannerAgent implements Planner {

    private static final Logger log = LoggerFactory.getLogger(PlannerAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are the planner of a deep research assistant. Break the user's query into
            a short sequence of steps that together gather everything needed for a
            comprehensive report.

            Step types:
            - research: look something up (set needSearch to true when web search is required)
            - processing: compute, compare or analyse data already gathered (never needs search)

            Rules:
            1. Use at most the number of steps you are given. Fewer focused steps beat many vague ones.
            2. Each step has a short title and a description precise enough to execute alone.
            3. Do not repeat research that the existing observations already cover.
            4. Set hasEnoughContext to true only if the existing observations already answer
               the query completely; in that case you may return zero steps.
            5. Explain your reasoning in thought. Write everything in the requested locale.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public PlannerAgent(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Plan plan(PlanRequest request) {
        // Planning uses structuredCall without MCP tools; the planner only structures steps.
        PlanDraft draft = llmService.structuredCall(
                AgentType.PLANNER, SYSTEM_PROMPT, buildUserPrompt(request), PlanDraft.class);
        Plan plan = toPlan(draft, request);
        log.info("Plan iteration {}: '{}' with {} step(s), hasEnoughContext={}",
                request.iteration(), plan.title(), plan.totalSteps(), plan.hasEnoughContext());
        return plan;
    }

    Plan toPlan(PlanDraft draft, PlanRequest request) {
        if (draft == null) {
            return new Plan(request.query(), "", List.of(), false, request.locale());
        }
        var steps = new ArrayList<Step>();
        if (draft.steps() != null) {
            for (PlanDraft.StepDraft s : draft.steps()) {
                if (s == null || s.title() == null || s.title().isBlank()) {
                    log.warn("Dropping planned step without a title");
                    continue;
                }
                StepType type = StepType.from(s.stepType());
                // processing steps never search
                boolean needSearch = type == StepType.RESEARCH && s.needSearch();
                steps.add(Step.pending(s.title().trim(),
                        s.description() != null ? s.description().trim() : "", type, needSearch));
            }
        }
        if (steps.size() > request.maxStepNum()) {
            log.warn("Planner returned {} steps, keeping the first {}", steps.size(), request.maxStepNum());
            steps = new ArrayList<>(steps.subList(0, request.maxStepNum()));
        }
        String title = draft.title() != null && !draft.title().isBlank() ? draft.title().trim() : request.query();
        return new Plan(title, draft.thought(), steps, draft.hasEnoughContext(), request.locale());
    }

    private String buildUserPrompt(PlanRequest request) {
        var sb = new StringBuilder();
        sb.append(String.format("""
                Locale: %s
                Planning iteration: %d
                Maximum number of steps: %d

                Query: %s
                """,
                request.locale(), request.iteration(), request.maxStepNum(), request.query()));

        List<Observation> observations = request.observations();
        if (!observations.isEmpty()) {
            sb.append("\nObservations gathered so far:\n");
            for (int i = 0; i < observations.size(); i++) {
                Observation o = observations.get(i);
                sb.append(i + 1).append(". [").append(o.kind().name().toLowerCase()).append("] ")
                        .append(o.content()).append("\n");
            }
        }
        return sb.toString();
    }
}
