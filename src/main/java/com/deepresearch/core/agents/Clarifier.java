package com.deepresearch.core.agents;

import com.deepresearch.core.model.ClarificationTurn;
import com.deepresearch.core.model.ClarifyOutcome;
import com.deepresearch.core.model.ResearchConfig;

import java.util.List;

/**
 * Decides whether a query is specific enough to research, or which question to ask first.
 */
public interface Clarifier {

    /**
     * @param query   the original query
     * @param history earlier questions and the caller's answers, oldest first
     * @param config  session configuration
     */
    ClarifyOutcome clarify(String query, List<ClarificationTurn> history, ResearchConfig config);
}
