package com.architecture.diagram.vectorizer.exception;

public class UnknownLayoutException extends RuntimeException {

    public UnknownLayoutException(String layout) {
        super("Unsupported layout mode: " + layout);
    }
}
