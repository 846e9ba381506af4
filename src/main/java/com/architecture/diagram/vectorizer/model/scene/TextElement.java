package com.architecture.diagram.vectorizer.model.scene;

import lombok.Builder;
import lombok.Getter;

@Getter
public class TextElement extends SceneElement {

    private final String text;
    private final String containerRef;  // Explicit container (shape or connector) id

    @Builder
    public TextElement(String id, boolean deleted, Bounds bounds, String frameRef, String text, String containerRef) {
        super(id, deleted, bounds, frameRef);
        this.text = text;
        this.containerRef = containerRef;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TEXT;
    }
}
