package com.deepresearch.core.engine;

import com.deepresearch.core.model.ResearchStage;

/**
 * Wraps an exception thrown by a collaborator (clarifier, planner, reporter, ...)
 * together with the stage that was running.
 */
public class CollaboratorException extends RuntimeException {

    private final ResearchStage stage;

    public CollaboratorException(ResearchStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ResearchStage getStage() {
        return stage;
    }
}
