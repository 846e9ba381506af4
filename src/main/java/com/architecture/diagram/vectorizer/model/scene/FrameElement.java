package com.architecture.diagram.vectorizer.model.scene;

import lombok.Builder;
import lombok.Getter;

@Getter
public class FrameElement extends SceneElement {

    private final String name;

    @Builder
    public FrameElement(String id, boolean deleted, Bounds bounds, String frameRef, String name) {
        super(id, deleted, bounds, frameRef);
        this.name = name;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.FRAME;
    }
}
