package com.architecture.diagram.vectorizer.model;

/**
 * Recoverable conditions reported alongside a successful conversion.
 */
public enum WarningType {
    UNRESOLVED_BINDING,
    UNSUPPORTED_SHAPE
}
