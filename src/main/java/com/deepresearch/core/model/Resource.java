package com.deepresearch.core.model;

import java.io.Serializable;

/**
 * A source discovered while executing a step.
 */
public record Resource(String url, String title) implements Serializable {
}
