package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.AgentFindings;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.state.StepContext;
import com.deepresearch.mcp.McpToolProvider;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

/**
 * Executes research steps. Search tools are only handed to the model when the
 * step asks for them.
 */
@Component
public class ResearcherAgent {

    private static final String SYSTEM_PROMPT = """
            You are a researcher working on one step of a larger research plan.
            Find accurate, current information for the step and summarise it in Markdown.
            Prefer primary sources, state figures with their dates, and say clearly
            when information could not be found instead of guessing.
            List every page you relied on as a source with its URL and title.
            Write in the requested locale.

            Respond with valid JSON matching the schema provided.
            """;

    private static final ToolCallback[] NO_TOOLS = new ToolCallback[0];

    private final LlmService llmService;
    private final McpToolProvider toolProvider;

    public ResearcherAgent(LlmService llmService, McpToolProvider toolProvider) {
        this.llmService = llmService;
        this.toolProvider = toolProvider;
    }

    public AgentFindings research(Step step, StepContext context) {
        ToolCallback[] tools = step.needSearch()
                ? toolProvider.getToolsFor(AgentType.RESEARCHER.tag())
                : NO_TOOLS;
        return llmService.structuredCallWithTools(AgentType.RESEARCHER, SYSTEM_PROMPT,
                StepPrompts.forStep(step, context), AgentFindings.class, tools);
    }
}
