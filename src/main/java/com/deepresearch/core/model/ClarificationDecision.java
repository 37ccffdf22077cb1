package com.deepresearch.core.model;

/**
 * Structured output from the coordinator deciding whether a query is specific enough.
 *
 * @param needsClarification true when one more question must be asked
 * @param question           the question to ask, when clarification is needed
 * @param clarifiedQuery     the query rewritten with every answer folded in
 */
public record ClarificationDecision(
    boolean needsClarification,
    String question,
    String clarifiedQuery
) {}
