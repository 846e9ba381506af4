package com.architecture.diagram.vectorizer.model.scene;

import lombok.Getter;

/**
 * Base of the closed set of typed raw scene elements.
 * Every element has a raw id, a deleted flag, bounds and an optional explicit frame reference.
 */
@Getter
public abstract class SceneElement {

    private final String id;
    private final boolean deleted;
    private final Bounds bounds;
    private final String frameRef;

    protected SceneElement(String id, boolean deleted, Bounds bounds, String frameRef) {
        this.id = id;
        this.deleted = deleted;
        this.bounds = bounds;
        this.frameRef = frameRef;
    }

    public abstract ElementKind getKind();

    public boolean isLive() {
        return !deleted;
    }
}
