package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of diagram kinds carried by a {@link Diagram}.
 */
public enum DiagramType {
    FLOWCHART("flowchart"),
    SEQUENCE("sequence"),
    ARCHITECTURE("architecture"),
    ERD("erd"),
    MINDMAP("mindmap"),
    FREEFORM("freeform");

    private final String value;

    DiagramType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from a string, case-insensitive.
     * Returns null when the value does not name a diagram type.
     */
    public static DiagramType fromString(String value) {
        if (value == null) return null;
        for (DiagramType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
