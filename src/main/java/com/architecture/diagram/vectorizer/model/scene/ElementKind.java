package com.architecture.diagram.vectorizer.model.scene;

/**
 * The four kinds of raw scene element understood by extraction.
 */
public enum ElementKind {
    SHAPE,
    TEXT,
    CONNECTOR,
    FRAME
}
