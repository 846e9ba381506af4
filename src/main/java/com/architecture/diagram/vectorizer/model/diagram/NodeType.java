package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enum representing the shape kinds a diagram node can take.
 */
public enum NodeType {
    RECTANGLE("rectangle"),
    ELLIPSE("ellipse"),
    CIRCLE("circle"),
    DIAMOND("diamond"),
    CYLINDER("cylinder"),
    PARALLELOGRAM("parallelogram");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from a string, case-insensitive.
     * Returns null for unmapped shape kinds so callers can decide how to degrade.
     */
    public static NodeType fromString(String value) {
        if (value == null) return null;
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
