package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.ClarificationDecision;
import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.ClarifyOutcome;
import com.deepresearch.core.model.ResearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * LLM-backed {@link Clarifier}. Asks at most one question per turn and folds
 * earlier answers into the clarified query.
 */
@Component
public class CoordinatorAgent implements Clarifier {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are the coordinator of a deep research assistant. Before any research starts,
            decide whether the user's query is specific enough to plan a thorough investigation.

            A query needs clarification when a reasonable researcher could not tell:
            - which subject, product, market or region is meant
            - which time period matters
            - what kind of answer is expected (comparison, overview, recommendation, numbers)

            Rules:
            1. Ask at most ONE question, the one whose answer changes the research the most.
            2. Never ask about things the query or earlier answers already settle.
            3. If the query is researchable as is, set needsClarification to false.
            4. Always return clarifiedQuery: the query rewritten as one precise research
               question that incorporates every earlier answer.
            5. Write the question and the clarified query in the requested locale.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public CoordinatorAgent(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ClarifyOutcome clarify(String query, List<ClarificationTurn> history, ResearchConfig config) {
        List<ClarificationTurn> turns = history != null ? history : List.of();
        String fallbackQuery = ClarificationTurn.foldInto(query, turns);
        if (!config.enableClarification()) {
            return ClarifyOutcome.proceed(fallbackQuery);
        }

        ClarificationDecision decision = llmService.structuredCall(
                AgentType.COORDINATOR, SYSTEM_PROMPT, buildUserPrompt(query, turns, config), ClarificationDecision.class);

        if (decision != null && decision.needsClarification()
                && decision.question() != null && !decision.question().isBlank()) {
            log.info("Coordinator asks for clarification (round {})", turns.size() + 1);
            return ClarifyOutcome.needMoreInput(decision.question().trim());
        }

        String clarified = decision != null && decision.clarifiedQuery() != null && !decision.clarifiedQuery().isBlank()
                ? decision.clarifiedQuery().trim()
                : fallbackQuery;
        log.info("Coordinator proceeds with clarified query ({} chars)", clarified.length());
        return ClarifyOutcome.proceed(clarified);
    }

    private String buildUserPrompt(String query, List<ClarificationTurn> history, ResearchConfig config) {
        var sb = new StringBuilder();
        sb.append("Locale: ").append(config.locale()).append("\n\n");
        sb.append("User query: ").append(query).append("\n");
        if (!history.isEmpty()) {
            sb.append("\nEarlier clarification:\n");
            for (ClarificationTurn turn : history) {
                sb.append("Q: ").append(turn.question()).append("\n");
                sb.append("A: ").append(turn.answer()).append("\n");
            }
        }
        return sb.toString();
    }
}
