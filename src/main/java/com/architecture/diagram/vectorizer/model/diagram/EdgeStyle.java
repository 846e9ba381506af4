package com.architecture.diagram.vectorizer.model.diagram;

import lombok.Builder;
import lombok.Value;

/**
 * Visual styling for an edge. Only the stroke pattern survives normalization.
 */
@Value
@Builder
public class EdgeStyle {

    StrokeStyle strokeStyle;

    public static EdgeStyle of(StrokeStyle strokeStyle) {
        return new EdgeStyle(strokeStyle);
    }
}
