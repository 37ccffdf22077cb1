package com.deepresearch.core.engine;

/**
 * Thrown when a research id does not refer to a known session.
 */
public class ResearchSessionNotFoundException extends RuntimeException {

    public ResearchSessionNotFoundException(String researchId) {
        super("Research session not found: " + researchId);
    }
}
