package com.architecture.diagram.vectorizer.model.scene;

import lombok.Builder;
import lombok.Getter;

@Getter
public class ShapeElement extends SceneElement {

    private final String rawType;       // rectangle, ellipse, diamond, freedraw, image, ...
    private final String text;          // Inline text some sources store on the shape itself
    private final String fillColor;
    private final String strokeColor;
    private final Double strokeWidth;

    @Builder
    public ShapeElement(String id, boolean deleted, Bounds bounds, String frameRef, String rawType,
                        String text, String fillColor, String strokeColor, Double strokeWidth) {
        super(id, deleted, bounds, frameRef);
        this.rawType = rawType;
        this.text = text;
        this.fillColor = fillColor;
        this.strokeColor = strokeColor;
        this.strokeWidth = strokeWidth;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SHAPE;
    }
}
