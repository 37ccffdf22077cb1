package com.deepresearch.core.model;

import java.util.List;

/**
 * Structured output from a research or processing agent for one step.
 *
 * @param summary the step's findings in Markdown
 * @param sources pages the findings were drawn from
 */
public record AgentFindings(
    String summary,
    List<Source> sources
) {

    public record Source(String url, String title) {}

    /**
     * Converts LLM-reported sources to resources, dropping entries without a URL.
     */
    public static List<Resource> toResources(List<Source> sources) {
        if (sources == null) {
            return List.of();
        }
        return sources.stream()
                .filter(s -> s != null && s.url() != null && !s.url().isBlank())
                .map(s -> new Resource(s.url(), s.title()))
                .toList();
    }
}
