package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.AgentFindings;
import com.deepresearch.core.model.Step;
import com.deepresearch.core.state.StepContext;
import com.deepresearch.mcp.McpToolProvider;
import org.springframework.stereotype.Component;

/**
 * Executes processing steps: calculations, comparisons and data analysis over
 * the findings gathered so far, using code-execution tools when a server offers them.
 */
@Component
public class CoderAgent {

    private static final String SYSTEM_PROMPT = """
            You are a data analyst working on one processing step of a research plan.
            Use the findings provided to compute, compare or analyse what the step asks for.
            When a code execution tool is available, use it for any non-trivial calculation
            and report the results rather than the code. Show key numbers in Markdown tables.
            Do not invent data that is not in the findings.
            Write in the requested locale.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final McpToolProvider toolProvider;

    public CoderAgent(LlmService llmService, McpToolProvider toolProvider) {
        this.llmService = llmService;
        this.toolProvider = toolProvider;
    }

    public AgentFindings process(Step step, StepContext context) {
        return llmService.structuredCallWithTools(AgentType.CODER, SYSTEM_PROMPT,
                StepPrompts.forStep(step, context), AgentFindings.class,
                toolProvider.getToolsFor(AgentType.CODER.tag()));
    }
}
