package com.architecture.diagram.vectorizer.exception;

/**
 * Malformed or incomplete Intermediate Model input: a missing required field, a duplicate id,
 * or a dangling edge/group reference. Fatal for the one diagram being processed.
 */
public class DiagramSchemaException extends RuntimeException {

    public DiagramSchemaException(String message) {
        super(message);
    }
}
