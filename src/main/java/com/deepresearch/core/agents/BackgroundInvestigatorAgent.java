package com.deepresearch.core.agents;

import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmService;
import com.deepresearch.core.model.AgentFindings;
import com.deepresearch.core.model.BackgroundDigest;
import com.deepresearch.core.model.BackgroundFindings;
import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.ResearchConfig;
import com.deepresearch.core.model.Resource;
import com.deepresearch.mcp.McpToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * LLM-backed {@link BackgroundInvestigator} that runs a quick search with the
 * researcher's MCP tools before planning.
 */
@Component
public class BackgroundInvestigatorAgent implements BackgroundInvestigator {

    private static final Logger log = LoggerFactory.getLogger(BackgroundInvestigatorAgent.class);

    private static final String SYSTEM_PROMPT = """
            You gather quick background information for a research planner.
            Use the available search tools to look up the query once or twice and
            return a handful of short, factual findings (one or two sentences each).
            Do not analyse or conclude; the planner decides what to research in depth.
            List every page you used as a source. Write in the requested locale.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final McpToolProvider toolProvider;

    public BackgroundInvestigatorAgent(LlmService llmService, McpToolProvider toolProvider) {
        this.llmService = llmService;
        this.toolProvider = toolProvider;
    }

    @Override
    public BackgroundFindings investigate(String query, ResearchConfig config) {
        var tools = toolProvider.getToolsFor(AgentType.RESEARCHER.tag());
        String userPrompt = "Locale: " + config.locale() + "\n\nQuery: " + query;
        BackgroundDigest digest = llmService.structuredCallWithTools(
                AgentType.BACKGROUND_INVESTIGATOR, SYSTEM_PROMPT, userPrompt, BackgroundDigest.class, tools);

        if (digest == null || digest.findings() == null) {
            return BackgroundFindings.empty();
        }
        List<Observation> observations = digest.findings().stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> Observation.background(f.trim()))
                .toList();
        List<Resource> resources = AgentFindings.toResources(digest.sources());
        log.info("Background investigation found {} finding(s), {} source(s)", observations.size(), resources.size());
        return new BackgroundFindings(observations, resources);
    }
}
