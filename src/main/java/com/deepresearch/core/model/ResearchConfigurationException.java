package com.deepresearch.core.model;

/**
 * Thrown when a query or research configuration is invalid. Raised before a
 * session is created, so no partial state exists.
 */
public class ResearchConfigurationException extends RuntimeException {

    public ResearchConfigurationException(String message) {
        super(message);
    }
}
