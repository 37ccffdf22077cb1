package com.deepresearch.core.model;

import java.util.List;

/**
 * Structured output from the background investigator: short findings gathered
 * by a quick search before planning.
 */
public record BackgroundDigest(
    List<String> findings,
    List<AgentFindings.Source> sources
) {}
