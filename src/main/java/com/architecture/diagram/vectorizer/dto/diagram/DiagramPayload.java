package com.architecture.diagram.vectorizer.dto.diagram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Loosely-typed diagram JSON as produced by a vision model.
 * Validated into an immutable Diagram before use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagramPayload {

    private String diagramType;
    private String title;
    private String source;
    private List<NodePayload> nodes;
    private List<EdgePayload> edges;
    private List<GroupPayload> groups;
}
