package com.deepresearch.core.model;

/**
 * Origin of an {@link Observation}.
 */
public enum ObservationKind {
    BACKGROUND,
    STEP_RESULT,
    STEP_FAILURE
}
