package com.architecture.diagram.vectorizer.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts reported after extracting a diagram from a raw scene.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionSummary {

    private int nodeCount;
    private int edgeCount;
    private int groupCount;
    private int droppedConnectors;      // Connectors whose endpoints did not both map to nodes
    private int unmappedShapes;         // Shapes degraded to rectangle
    private int unattachedText;         // Text not bound to any shape or connector
    private int skippedDeleted;         // Elements flagged as deleted in the source
}
