package com.deepresearch.core.model;

import java.util.List;

/**
 * Output of the background investigation pass.
 */
public record BackgroundFindings(List<Observation> observations, List<Resource> resources) {

    public BackgroundFindings {
        observations = observations != null ? List.copyOf(observations) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public static BackgroundFindings empty() {
        return new BackgroundFindings(List.of(), List.of());
    }
}
