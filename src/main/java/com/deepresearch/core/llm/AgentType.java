package com.deepresearch.core.llm;

/**
 * The LLM-backed roles of a research session. The tag is the key used for per-agent
 * model configuration and for MCP tool consumers.
 */
public enum AgentType {

    COORDINATOR("coordinator"),
    BACKGROUND_INVESTIGATOR("background-investigator"),
    PLANNER("planner"),
    RESEARCHER("researcher"),
    CODER("coder");

    private final String tag;

    AgentType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
