package com.deepresearch.core.llm;

/**
 * The model answered an agent with content that is not the JSON shape the agent asked for,
 * even after the lenient fallback.
 */
public class LlmParseException extends LlmCallException {

    static final int EXCERPT_CHARS = 200;

    private final String excerpt;

    public LlmParseException(AgentType agent, String outputType, String response, Throwable cause) {
        super(agent, outputType, "Could not read the " + agent.tag() + " agent's reply as " + outputType
                + ": " + cause.getMessage(), cause);
        this.excerpt = response.length() > EXCERPT_CHARS ? response.substring(0, EXCERPT_CHARS) + "..." : response;
    }

    /** The start of the raw reply, for logs and error reports. */
    public String excerpt() {
        return excerpt;
    }
}
