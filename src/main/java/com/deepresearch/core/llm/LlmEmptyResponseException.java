package com.deepresearch.core.llm;

/**
 * The model answered an agent with null or blank content.
 */
public class LlmEmptyResponseException extends LlmCallException {

    public LlmEmptyResponseException(AgentType agent, String outputType) {
        super(agent, outputType, "The " + agent.tag() + " agent got no content back for " + outputType
                + "; check that the model is running and supports structured JSON output", null);
    }
}
