package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.ClarificationDecision;
import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.ClarifyOutcome;
import com.deepresearch.core.model.ResearchConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CoordinatorAgentTest {

    private LlmService mockLlm;
    private CoordinatorAgent coordinator;

    @BeforeEach
    void setUp() {
        mockLlm = mock(LlmService.class);
        coordinator = new CoordinatorAgent(mockLlm);
    }

    @Test
    @DisplayName("asks the model's question when clarification is needed")
    void asksQuestion() {
        when(mockLlm.structuredCall(eq(AgentType.COORDINATOR), anyString(), anyString(), eq(ClarificationDecision.class)))
                .thenReturn(new ClarificationDecision(true, "Which region?", null));

        ClarifyOutcome outcome = coordinator.clarify("EV adoption", List.of(), ResearchConfig.defaults());

        assertTrue(outcome.needsMoreInput());
        assertEquals("Which region?", outcome.question());
    }

    @Test
    @DisplayName("proceeds with the clarified query")
    void proceedsWithClarifiedQuery() {
        when(mockLlm.structuredCall(any(), anyString(), anyString(), eq(ClarificationDecision.class)))
                .thenReturn(new ClarificationDecision(false, null, "EV adoption in Europe since 2020"));

        ClarifyOutcome outcome = coordinator.clarify("EV adoption",
                List.of(new ClarificationTurn("Which region?", "Europe")), ResearchConfig.defaults());

        assertFalse(outcome.needsMoreInput());
        assertEquals("EV adoption in Europe since 2020", outcome.clarifiedQuery());
    }

    @Test
    @DisplayName("falls back to the folded query when the model gives none")
    void fallsBackToFoldedQuery() {
        when(mockLlm.structuredCall(any(), anyString(), anyString(), eq(ClarificationDecision.class)))
                .thenReturn(new ClarificationDecision(true, " ", null));

        ClarifyOutcome outcome = coordinator.clarify("EV adoption",
                List.of(new ClarificationTurn("Which region?", "Europe")), ResearchConfig.defaults());

        assertFalse(outcome.needsMoreInput());
        assertTrue(outcome.clarifiedQuery().contains("Europe"));
    }

    @Test
    @DisplayName("does not call the model when clarification is disabled")
    void disabledSkipsModel() {
        ClarifyOutcome outcome = coordinator.clarify("EV adoption", List.of(),
                ResearchConfig.defaults().withClarification(false));

        assertEquals("EV adoption", outcome.clarifiedQuery());
        verifyNoInteractions(mockLlm);
    }
}
