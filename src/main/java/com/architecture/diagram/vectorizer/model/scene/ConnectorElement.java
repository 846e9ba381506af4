package com.architecture.diagram.vectorizer.model.scene;

import com.architecture.diagram.vectorizer.model.diagram.StrokeStyle;
import lombok.Builder;
import lombok.Getter;

/**
 * An arrow or line. Endpoints are absolute scene coordinates.
 */
@Getter
public class ConnectorElement extends SceneElement {

    private final boolean arrow;
    private final String startRef;
    private final String endRef;
    private final Point startPoint;
    private final Point endPoint;
    private final StrokeStyle strokeStyle;

    @Builder
    public ConnectorElement(String id, boolean deleted, Bounds bounds, String frameRef, boolean arrow,
                            String startRef, String endRef, Point startPoint, Point endPoint,
                            StrokeStyle strokeStyle) {
        super(id, deleted, bounds, frameRef);
        this.arrow = arrow;
        this.startRef = startRef;
        this.endRef = endRef;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.strokeStyle = strokeStyle != null ? strokeStyle : StrokeStyle.SOLID;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CONNECTOR;
    }
}
