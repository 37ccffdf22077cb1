package com.deepresearch.core.llm;

/**
 * An LLM call made for one of the research agents did not yield the typed output it asked for.
 */
public abstract class LlmCallException extends RuntimeException {

    private final AgentType agent;
    private final String outputType;

    protected LlmCallException(AgentType agent, String outputType, String message, Throwable cause) {
        super(message, cause);
        this.agent = agent;
        this.outputType = outputType;
    }

    public AgentType agent() {
        return agent;
    }

    /** Simple name of the record the agent expected. */
    public String outputType() {
        return outputType;
    }
}
