package com.deepresearch.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LLM settings. {@code model} is the default for every agent; entries under
 * {@code models} (keyed by {@link AgentType#tag()}) override it per agent.
 */
@Component
@ConfigurationProperties(prefix = "deepresearch.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "";
    private Map<String, String> models = new LinkedHashMap<>();

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Map<String, String> getModels() {
        return models;
    }

    public void setModels(Map<String, String> models) {
        this.models = models;
    }

    /**
     * Returns the model configured for the agent, falling back to the default model.
     * An empty string means "use whatever the chat client is configured with".
     */
    public String modelFor(AgentType agent) {
        String specific = models != null ? models.get(agent.tag()) : null;
        if (specific != null && !specific.isBlank()) {
            return specific;
        }
        return model != null ? model : "";
    }
}
