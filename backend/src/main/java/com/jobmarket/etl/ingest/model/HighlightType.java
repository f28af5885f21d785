package com.jobmarket.etl.ingest.model;

import java.util.Locale;

public enum HighlightType {
    QUALIFICATIONS,
    RESPONSIBILITIES,
    BENEFITS;

    public static HighlightType fromSourceKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        for (HighlightType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
