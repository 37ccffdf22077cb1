package com.deepresearch.core.model;

/**
 * Result of the coordinator's clarification pass: either proceed with a
 * (possibly rewritten) query, or ask the caller a question.
 *
 * @param needsMoreInput  true when the workflow must stop and wait for the caller
 * @param clarifiedQuery  query to plan against; set when proceeding
 * @param question        question for the caller; set when more input is needed
 */
public record ClarifyOutcome(boolean needsMoreInput, String clarifiedQuery, String question) {

    public static ClarifyOutcome proceed(String clarifiedQuery) {
        return new ClarifyOutcome(false, clarifiedQuery, null);
    }

    public static ClarifyOutcome needMoreInput(String question) {
        return new ClarifyOutcome(true, null, question);
    }
}
