package com.deepresearch.core.agents;

import com.deepresearch.core.model.BackgroundFindings;
import com.deepresearch.core.model.ResearchConfig;

/**
 * Runs a quick preliminary search before the first plan is made.
 * Failures are tolerated by the caller.
 */
public interface BackgroundInvestigator {

    BackgroundFindings investigate(String query, ResearchConfig config);
}
