package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A directed connection between two nodes of the Intermediate Model.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramEdge {

    String id;
    String from;
    String to;
    @Builder.Default
    EdgeType type = EdgeType.ARROW;
    String label;
    EdgeStyle style;
    @Builder.Default
    double confidence = 1.0;

    @JsonIgnore
    public StrokeStyle getStrokeStyle() {
        return style != null && style.getStrokeStyle() != null ? style.getStrokeStyle() : StrokeStyle.SOLID;
    }

    @JsonIgnore
    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }
}
