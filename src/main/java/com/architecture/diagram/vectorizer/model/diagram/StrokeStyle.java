package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stroke pattern of an edge.
 */
public enum StrokeStyle {
    SOLID("solid"),
    DASHED("dashed"),
    DOTTED("dotted");

    private final String value;

    StrokeStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown or missing patterns read as solid.
     */
    public static StrokeStyle fromString(String value) {
        if (value == null) return SOLID;
        for (StrokeStyle style : values()) {
            if (style.value.equalsIgnoreCase(value.trim())) {
                return style;
            }
        }
        return SOLID;
    }
}
