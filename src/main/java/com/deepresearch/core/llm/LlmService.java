package com.deepresearch.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * Java class, append format instructions to the user prompt, and deserialize
 * the LLM's JSON response into the requested type. Each call names the
 * {@link AgentType} making it so a per-agent model can be selected.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized with provider {} (base-url: {})", properties.getProvider(), baseUrl);
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param agent        the role making the call, used for model selection and logging
     * @param systemPrompt instructions for the LLM's role
     * @param userPrompt   the request text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     */
    public <T> T structuredCall(AgentType agent, String systemPrompt, String userPrompt, Class<T> outputType) {
        return call(agent, systemPrompt, userPrompt, outputType, new ToolCallback[0]);
    }

    /**
     * Like {@link #structuredCall}, but also provides MCP tools to the LLM.
     * Falls back to the tool-less path when no tools are supplied.
     */
    public <T> T structuredCallWithTools(AgentType agent, String systemPrompt, String userPrompt,
                                         Class<T> outputType, ToolCallback... tools) {
        if (tools == null || tools.length == 0) {
            return structuredCall(agent, systemPrompt, userPrompt, outputType);
        }
        return call(agent, systemPrompt, userPrompt, outputType, tools);
    }

    private <T> T call(AgentType agent, String systemPrompt, String userPrompt,
                       Class<T> outputType, ToolCallback[] tools) {
        String name = outputType.getSimpleName();
        log.info("LLM call started for {} -> {} ({} tool(s))", agent.tag(), name, tools.length);
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);

        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat());
        String model = properties.modelFor(agent);
        if (!model.isBlank()) {
            request = request.options(ChatOptions.builder().model(model).build());
        }
        if (tools.length > 0) {
            request = request.toolCallbacks(tools);
        }
        String response = request.call().content();

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete for {} -> {} ({}s)", agent.tag(), name, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(agent, name);
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", name, e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(agent, response, outputType);
        }
    }

    /**
     * Fallback JSON parsing with lenient settings, tolerating markdown code fences.
     */
    private <T> T parseWithJackson(AgentType agent, String json, Class<T> outputType) {
        try {
            String cleaned = stripCodeFence(json);
            log.info("Jackson fallback parsing {} chars for {}", cleaned.length(), outputType.getSimpleName());
            return lenientMapper.readValue(cleaned, outputType);
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException(agent, outputType.getSimpleName(), json, e);
        }
    }

    static String stripCodeFence(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
