package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A node of the Intermediate Model.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramNode {

    public static final double DEFAULT_WIDTH = 120;
    public static final double DEFAULT_HEIGHT = 60;

    String id;
    NodeType type;
    @Builder.Default
    String label = "";
    Double x;             // Optional, absent for purely structural sources
    Double y;
    @Builder.Default
    double width = DEFAULT_WIDTH;
    @Builder.Default
    double height = DEFAULT_HEIGHT;
    NodeStyle style;
    @Builder.Default
    double confidence = 1.0;

    @JsonIgnore
    public boolean hasPosition() {
        return x != null && y != null;
    }

    /**
     * X coordinate for positional layout, 0 when the node carries none.
     */
    @JsonIgnore
    public double getLayoutX() {
        return x != null ? x : 0;
    }

    @JsonIgnore
    public double getLayoutY() {
        return y != null ? y : 0;
    }
}
