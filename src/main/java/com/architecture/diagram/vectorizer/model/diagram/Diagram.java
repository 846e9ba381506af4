package com.architecture.diagram.vectorizer.model.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the Intermediate Model: the canonical node/edge/group graph that decouples
 * diagram sources from output formats.
 *
 * Instances are immutable. They are produced either by the extraction pipeline or by
 * validating vision-model JSON, and are consumed by the render dispatcher.
 * Node, edge and group order is significant: emitters preserve it so re-renders are stable.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagram {

    DiagramType diagramType;
    String title;
    String source;       // excalidraw, vision, ...
    @Singular
    List<DiagramNode> nodes;
    @Singular
    List<DiagramEdge> edges;
    @Singular
    List<DiagramGroup> groups;

    /**
     * Nodes keyed by id, in diagram order.
     */
    @JsonIgnore
    public Map<String, DiagramNode> getNodesById() {
        Map<String, DiagramNode> byId = new LinkedHashMap<>();
        for (DiagramNode node : nodes) {
            byId.putIfAbsent(node.getId(), node);
        }
        return byId;
    }

    @JsonIgnore
    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
