package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Visual styling carried through from the source for a node.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeStyle {

    String fillColor;     // Hex color (e.g., "#a5d8ff") or named color
    String strokeColor;   // Border color
    Double strokeWidth;   // Border width in source units

    @JsonIgnore
    public boolean isEmpty() {
        return fillColor == null && strokeColor == null && strokeWidth == null;
    }
}
