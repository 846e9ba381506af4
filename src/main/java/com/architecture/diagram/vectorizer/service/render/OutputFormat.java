package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.exception.UnknownFormatException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Supported output grammars with their default layout policy and conventional file extension.
 */
public enum OutputFormat {
    MERMAID("mermaid", List.of("mmd"), LayoutMode.STRUCTURAL, ".mmd"),
    GRAPHVIZ("graphviz", List.of("dot"), LayoutMode.STRUCTURAL, ".dot"),
    DRAWIO("drawio", List.of("xml"), LayoutMode.POSITIONAL, ".drawio"),
    SVG("svg", List.of(), LayoutMode.POSITIONAL, ".svg");

    private final String key;
    private final List<String> aliases;
    private final LayoutMode defaultLayout;
    private final String extension;

    OutputFormat(String key, List<String> aliases, LayoutMode defaultLayout, String extension) {
        this.key = key;
        this.aliases = aliases;
        this.defaultLayout = defaultLayout;
        this.extension = extension;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public LayoutMode getDefaultLayout() {
        return defaultLayout;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Resolve a format name or alias, case-insensitive.
     *
     * @throws UnknownFormatException when the name matches no supported format
     */
    public static OutputFormat fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.key.equals(normalized) || format.aliases.contains(normalized)) {
                    return format;
                }
            }
        }
        throw new UnknownFormatException(value);
    }
}
