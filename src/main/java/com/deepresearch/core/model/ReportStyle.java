package com.deepresearch.core.model;

import java.util.Locale;

/**
 * Rendering mode of the final report.
 */
public enum ReportStyle {
    ACADEMIC("academic"),
    NEWS("news"),
    SOCIAL_MEDIA("social"),
    INVESTMENT("investment");

    private final String tag;

    ReportStyle(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a style tag, falling back to {@link #ACADEMIC} for anything unknown.
     */
    public static ReportStyle from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACADEMIC;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ReportStyle style : values()) {
            if (style.tag.equals(normalized) || style.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return style;
            }
        }
        return ACADEMIC;
    }
}
