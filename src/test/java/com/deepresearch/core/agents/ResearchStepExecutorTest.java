package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.AgentFindings;
import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.model.StepResult;
import com.deepresearch.core.model.StepStatus;
import com.deepresearch.core.model.StepType;
import com.deepresearch.core.state.StepContext;
import com.deepresearch.mcp.McpToolProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ResearchStepExecutor} and the step agents behind it.
 */
class ResearchStepExecutorTest {

    private LlmService mockLlm;
    private McpToolProvider mockTools;
    private ToolCallback searchTool;
    private ResearchStepExecutor executor;

    @BeforeEach
    void setUp() {
        mockLlm = mock(LlmService.class);
        mockTools = mock(McpToolProvider.class);
        searchTool = mock(ToolCallback.class);
        when(mockTools.getToolsFor(anyString())).thenReturn(new ToolCallback[]{searchTool});
        executor = new ResearchStepExecutor(new ResearcherAgent(mockLlm, mockTools), new CoderAgent(mockLlm, mockTools));
    }

    private static StepContext context() {
        return new StepContext("DR-1", "What is LangGraph?", "en-US", 0, 1,
                List.of(Observation.background("LangGraph is a library")), List.of());
    }

    private static Step running(StepType type, boolean needSearch) {
        return Step.pending("Find docs", "Read the docs", type, needSearch).start();
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("research steps go to the researcher with its search tools")
        void researchUsesResearcherTools() {
            when(mockLlm.structuredCallWithTools(eq(AgentType.RESEARCHER), anyString(), anyString(),
                    eq(AgentFindings.class), any(ToolCallback[].class)))
                    .thenReturn(new AgentFindings("LangGraph builds agent graphs",
                            List.of(new AgentFindings.Source("https://docs.example", "Docs"))));

            StepResult result = executor.execute(running(StepType.RESEARCH, true), context());

            assertEquals(StepStatus.COMPLETED, result.status());
            assertEquals("LangGraph builds agent graphs", result.executionResult());
            assertEquals("https://docs.example", result.resources().get(0).url());
            verify(mockTools).getToolsFor("researcher");
        }

        @Test
        @DisplayName("research steps without need_search get no tools")
        void noSearchNoTools() {
            ArgumentCaptor<ToolCallback[]> toolsCaptor = ArgumentCaptor.forClass(ToolCallback[].class);
            when(mockLlm.structuredCallWithTools(eq(AgentType.RESEARCHER), anyString(), anyString(),
                    eq(AgentFindings.class), toolsCaptor.capture()))
                    .thenReturn(new AgentFindings("summary", List.of()));

            executor.execute(running(StepType.RESEARCH, false), context());

            assertEquals(0, toolsCaptor.getValue().length);
            verify(mockTools, never()).getToolsFor(anyString());
        }

        @Test
        @DisplayName("processing steps go to the coder with the coder's tools")
        void processingUsesCoder() {
            when(mockLlm.structuredCallWithTools(eq(AgentType.CODER), anyString(), anyString(),
                    eq(AgentFindings.class), any(ToolCallback[].class)))
                    .thenReturn(new AgentFindings("| a | b |", List.of()));

            StepResult result = executor.execute(running(StepType.PROCESSING, false), context());

            assertTrue(result.succeeded());
            verify(mockTools).getToolsFor("coder");
        }

        @Test
        @DisplayName("the step prompt carries the query and earlier findings")
        void promptCarriesContext() {
            ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
            when(mockLlm.structuredCallWithTools(any(), anyString(), userCaptor.capture(),
                    eq(AgentFindings.class), any(ToolCallback[].class)))
                    .thenReturn(new AgentFindings("summary", List.of()));

            executor.execute(running(StepType.RESEARCH, true), context());

            assertTrue(userCaptor.getValue().contains("What is LangGraph?"));
            assertTrue(userCaptor.getValue().contains("LangGraph is a library"));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("empty findings fail the step")
        void emptyFindingsFail() {
            when(mockLlm.structuredCallWithTools(any(), anyString(), anyString(),
                    eq(AgentFindings.class), any(ToolCallback[].class)))
                    .thenReturn(new AgentFindings("  ", List.of()));

            StepResult result = executor.execute(running(StepType.RESEARCH, true), context());

            assertEquals(StepStatus.FAILED, result.status());
            assertEquals("Agent returned no findings for step 'Find docs'", result.executionResult());
        }

        @Test
        @DisplayName("agent exceptions become failed results")
        void exceptionBecomesFailure() {
            when(mockLlm.structuredCallWithTools(any(), anyString(), anyString(),
                    eq(AgentFindings.class), any(ToolCallback[].class)))
                    .thenThrow(new IllegalStateException("rate limited"));

            StepResult result = executor.execute(running(StepType.RESEARCH, true), context());

            assertEquals(StepStatus.FAILED, result.status());
            assertEquals("IllegalStateException: rate limited", result.executionResult());
        }
    }

    @Test
    @DisplayName("long observations are truncated in step prompts")
    void truncatesLongObservations() {
        String longText = "x".repeat(StepPrompts.MAX_OBSERVATION_CHARS + 100);
        assertEquals(StepPrompts.MAX_OBSERVATION_CHARS + 4, StepPrompts.truncate(longText).length());
        assertEquals("short", StepPrompts.truncate("short"));
    }
}
