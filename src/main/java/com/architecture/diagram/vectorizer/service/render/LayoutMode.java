package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.exception.UnknownLayoutException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Layout policy for rendering.
 * STRUCTURAL lets the target grammar's auto-layout place elements (no coordinates);
 * POSITIONAL carries source coordinates through verbatim.
 */
public enum LayoutMode {
    STRUCTURAL("structural"),
    POSITIONAL("positional");

    private final String value;

    LayoutMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a layout name; {@code structure} and {@code position} are accepted as aliases.
     * Returns null for a null or blank name so callers fall back to the format default.
     */
    public static LayoutMode fromString(String value) {
        if (value == null || value.isBlank()) return null;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "structural":
            case "structure":
                return STRUCTURAL;
            case "positional":
            case "position":
                return POSITIONAL;
            default:
                throw new UnknownLayoutException(value);
        }
    }
}
