package com.deepresearch.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/research/sessions/{id}/clarify.
 *
 * @param answer the caller's answer to the pending question
 */
public record ClarificationAnswerRequest(String answer) {}
