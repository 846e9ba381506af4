package com.architecture.diagram.vectorizer.exception;

/**
 * Requested output format is not supported. Fatal for that render request only.
 */
public class UnknownFormatException extends RuntimeException {

    public UnknownFormatException(String format) {
        super("Unsupported output format: " + format);
    }
}
