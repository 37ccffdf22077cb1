package com.deepresearch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * An immutable finding accumulated during a research session.
 *
 * @param content       the finding text
 * @param kind          where it came from
 * @param stepIndex     index of the originating step in its plan; null for background findings
 * @param planIteration plan iteration the finding was produced in (0 before the first plan)
 */
public record Observation(
    String content,
    ObservationKind kind,
    Integer stepIndex,
    int planIteration
) implements Serializable {

    public Observation {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(kind, "kind");
    }

    public static Observation background(String content) {
        return new Observation(content, ObservationKind.BACKGROUND, null, 0);
    }

    public static Observation stepResult(String content, int stepIndex, int planIteration) {
        return new Observation(content, ObservationKind.STEP_RESULT, stepIndex, planIteration);
    }

    public static Observation stepFailure(String content, int stepIndex, int planIteration) {
        return new Observation(content, ObservationKind.STEP_FAILURE, stepIndex, planIteration);
    }
}
