package com.architecture.diagram.vectorizer.service.diagram;

import com.architecture.diagram.vectorizer.dto.diagram.DiagramPayload;
import com.architecture.diagram.vectorizer.dto.diagram.EdgePayload;
import com.architecture.diagram.vectorizer.dto.diagram.GroupPayload;
import com.architecture.diagram.vectorizer.dto.diagram.NodePayload;
import com.architecture.diagram.vectorizer.dto.diagram.StylePayload;
import com.architecture.diagram.vectorizer.exception.DiagramSchemaException;
import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.model.diagram.DiagramEdge;
import com.architecture.diagram.vectorizer.model.diagram.DiagramGroup;
import com.architecture.diagram.vectorizer.model.diagram.DiagramNode;
import com.architecture.diagram.vectorizer.model.diagram.DiagramType;
import com.architecture.diagram.vectorizer.model.diagram.EdgeStyle;
import com.architecture.diagram.vectorizer.model.diagram.EdgeType;
import com.architecture.diagram.vectorizer.model.diagram.NodeStyle;
import com.architecture.diagram.vectorizer.model.diagram.NodeType;
import com.architecture.diagram.vectorizer.model.diagram.StrokeStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates diagram JSON (typically vision-model output) into an immutable {@link Diagram}.
 *
 * Only structural invariants are checked: required fields, id uniqueness, referential integrity
 * of edges and groups, and the closed diagram/edge type enums. Confidence scores are carried
 * through untouched. Any violation raises {@link DiagramSchemaException}; nothing is dropped silently.
 */
@Service
@Slf4j
public class DiagramValidator {

    private static final String VISION_SOURCE = "vision";

    public ValidatedDiagram validate(DiagramPayload payload) {
        if (payload == null) {
            throw new DiagramSchemaException("Diagram payload is empty");
        }
        List<ConversionWarning> warnings = new ArrayList<>();

        DiagramType diagramType = DiagramType.FREEFORM;
        if (payload.getDiagramType() != null) {
            diagramType = DiagramType.fromString(payload.getDiagramType());
            if (diagramType == null) {
                throw new DiagramSchemaException("Unknown diagramType: " + payload.getDiagramType());
            }
        }

        Diagram.DiagramBuilder builder = Diagram.builder()
                .diagramType(diagramType)
                .title(payload.getTitle())
                .source(payload.getSource() != null ? payload.getSource() : VISION_SOURCE);

        Set<String> nodeIds = new HashSet<>();
        List<NodePayload> nodes = payload.getNodes() != null ? payload.getNodes() : List.of();
        for (int i = 0; i < nodes.size(); i++) {
            NodePayload node = nodes.get(i);
            String where = "nodes[" + i + "]";
            if (node == null) {
                throw new DiagramSchemaException(where + " is null");
            }
            requireField(node.getId(), where + ".id");
            requireField(node.getType(), where + ".type");
            if (node.getLabel() == null) {
                throw new DiagramSchemaException("Missing required field: " + where + ".label");
            }
            if (!nodeIds.add(node.getId())) {
                throw new DiagramSchemaException("Duplicate node id: " + node.getId());
            }
            builder.node(toNode(node, warnings));
        }

        Set<String> edgeIds = new HashSet<>();
        List<EdgePayload> edges = payload.getEdges() != null ? payload.getEdges() : List.of();
        for (int i = 0; i < edges.size(); i++) {
            EdgePayload edge = edges.get(i);
            String where = "edges[" + i + "]";
            if (edge == null) {
                throw new DiagramSchemaException(where + " is null");
            }
            requireField(edge.getId(), where + ".id");
            requireField(edge.getFrom(), where + ".from");
            requireField(edge.getTo(), where + ".to");
            if (!edgeIds.add(edge.getId())) {
                throw new DiagramSchemaException("Duplicate edge id: " + edge.getId());
            }
            requireNode(nodeIds, edge.getFrom(), "Edge " + edge.getId() + " references unknown node: ");
            requireNode(nodeIds, edge.getTo(), "Edge " + edge.getId() + " references unknown node: ");
            builder.edge(toEdge(edge));
        }

        Set<String> groupIds = new HashSet<>();
        List<GroupPayload> groups = payload.getGroups() != null ? payload.getGroups() : List.of();
        for (int i = 0; i < groups.size(); i++) {
            GroupPayload group = groups.get(i);
            String where = "groups[" + i + "]";
            if (group == null) {
                throw new DiagramSchemaException(where + " is null");
            }
            requireField(group.getId(), where + ".id");
            if (!groupIds.add(group.getId()) || nodeIds.contains(group.getId())) {
                throw new DiagramSchemaException("Duplicate group id: " + group.getId());
            }
            if (group.getNodeIds() == null || group.getNodeIds().isEmpty()) {
                throw new DiagramSchemaException("Group " + group.getId() + " has no nodeIds");
            }
            // Repeated members collapse, first occurrence keeps its position
            Set<String> members = new LinkedHashSet<>();
            for (String member : group.getNodeIds()) {
                requireNode(nodeIds, member, "Group " + group.getId() + " references unknown node: ");
                members.add(member);
            }
            builder.group(DiagramGroup.builder()
                    .id(group.getId())
                    .label(group.getLabel())
                    .nodeIds(members)
                    .build());
        }

        Diagram diagram = builder.build();
        log.debug("Validated diagram: {} nodes, {} edges, {} groups",
                diagram.getNodes().size(), diagram.getEdges().size(), diagram.getGroups().size());
        return new ValidatedDiagram(diagram, List.copyOf(warnings));
    }

    /**
     * Check the structural invariants of an already-built diagram.
     * Used before rendering so a hand-built or corrupted diagram never reaches an emitter.
     */
    public void verify(Diagram diagram) {
        if (diagram == null) {
            throw new DiagramSchemaException("Diagram is null");
        }
        if (diagram.getDiagramType() == null) {
            throw new DiagramSchemaException("Missing required field: diagramType");
        }
        Set<String> nodeIds = new HashSet<>();
        for (DiagramNode node : diagram.getNodes()) {
            requireField(node.getId(), "node.id");
            if (node.getType() == null) {
                throw new DiagramSchemaException("Missing required field: type on node " + node.getId());
            }
            if (!nodeIds.add(node.getId())) {
                throw new DiagramSchemaException("Duplicate node id: " + node.getId());
            }
        }
        Set<String> edgeIds = new HashSet<>();
        for (DiagramEdge edge : diagram.getEdges()) {
            requireField(edge.getId(), "edge.id");
            if (!edgeIds.add(edge.getId())) {
                throw new DiagramSchemaException("Duplicate edge id: " + edge.getId());
            }
            requireNode(nodeIds, edge.getFrom(), "Edge " + edge.getId() + " references unknown node: ");
            requireNode(nodeIds, edge.getTo(), "Edge " + edge.getId() + " references unknown node: ");
        }
        Set<String> groupIds = new HashSet<>();
        for (DiagramGroup group : diagram.getGroups()) {
            requireField(group.getId(), "group.id");
            if (!groupIds.add(group.getId()) || nodeIds.contains(group.getId())) {
                throw new DiagramSchemaException("Duplicate group id: " + group.getId());
            }
            if (group.getNodeIds().isEmpty()) {
                throw new DiagramSchemaException("Group " + group.getId() + " has no nodeIds");
            }
            for (String member : group.getNodeIds()) {
                requireNode(nodeIds, member, "Group " + group.getId() + " references unknown node: ");
            }
        }
    }

    private DiagramNode toNode(NodePayload node, List<ConversionWarning> warnings) {
        NodeType type = NodeType.fromString(node.getType());
        if (type == null) {
            log.warn("Unsupported node type '{}' on node {}, using rectangle", node.getType(), node.getId());
            warnings.add(ConversionWarning.unsupportedShape(node.getId(),
                    "Node type '" + node.getType() + "' mapped to rectangle"));
            type = NodeType.RECTANGLE;
        }

        DiagramNode.DiagramNodeBuilder builder = DiagramNode.builder()
                .id(node.getId())
                .type(type)
                .label(node.getLabel())
                .x(node.getX())
                .y(node.getY());
        if (node.getWidth() != null) {
            builder.width(node.getWidth());
        }
        if (node.getHeight() != null) {
            builder.height(node.getHeight());
        }
        if (node.getConfidence() != null) {
            builder.confidence(node.getConfidence());
        }
        StylePayload style = node.getStyle();
        if (style != null) {
            NodeStyle nodeStyle = NodeStyle.builder()
                    .fillColor(style.getFillColor())
                    .strokeColor(style.getStrokeColor())
                    .strokeWidth(style.getStrokeWidth())
                    .build();
            builder.style(nodeStyle.isEmpty() ? null : nodeStyle);
        }
        return builder.build();
    }

    private DiagramEdge toEdge(EdgePayload edge) {
        EdgeType type = EdgeType.ARROW;
        if (edge.getType() != null) {
            type = EdgeType.fromString(edge.getType());
            if (type == null) {
                throw new DiagramSchemaException("Unknown type '" + edge.getType() + "' on edge " + edge.getId());
            }
        }

        DiagramEdge.DiagramEdgeBuilder builder = DiagramEdge.builder()
                .id(edge.getId())
                .from(edge.getFrom())
                .to(edge.getTo())
                .type(type)
                .label(edge.getLabel() != null && !edge.getLabel().isEmpty() ? edge.getLabel() : null);
        if (edge.getStyle() != null && edge.getStyle().getStrokeStyle() != null) {
            StrokeStyle strokeStyle = StrokeStyle.fromString(edge.getStyle().getStrokeStyle());
            builder.style(EdgeStyle.of(strokeStyle));
        }
        if (edge.getConfidence() != null) {
            builder.confidence(edge.getConfidence());
        }
        return builder.build();
    }

    private void requireField(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new DiagramSchemaException("Missing required field: " + field);
        }
    }

    private void requireNode(Set<String> nodeIds, String nodeId, String message) {
        if (!nodeIds.contains(nodeId)) {
            throw new DiagramSchemaException(message + nodeId);
        }
    }
}
