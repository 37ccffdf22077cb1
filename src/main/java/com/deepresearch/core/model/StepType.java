package com.deepresearch.core.model;

/**
 * Capability a plan step needs: information gathering or computation.
 */
public enum StepType {
    RESEARCH,
    PROCESSING;

    /**
     * Lenient parse of a planner-supplied type tag. Anything unrecognised is
     * treated as research.
     */
    public static StepType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RESEARCH;
        }
        return "processing".equalsIgnoreCase(raw.trim()) ? PROCESSING : RESEARCH;
    }
}
