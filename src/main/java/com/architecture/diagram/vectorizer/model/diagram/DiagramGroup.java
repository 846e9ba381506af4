package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A named cluster of nodes. A node may belong to several groups.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramGroup {

    String id;
    String label;
    @Singular
    List<String> nodeIds;
}
