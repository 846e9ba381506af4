package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeType {
    ARROW("arrow"),
    LINE("line");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EdgeType fromString(String value) {
        if (value == null) return null;
        for (EdgeType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
