package com.architecture.diagram.vectorizer.service.extraction;

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
import com.architecture.diagram.vectorizer.model.scene.ConnectorElement;
import com.architecture.diagram.vectorizer.model.scene.FrameElement;
import com.architecture.diagram.vectorizer.model.scene.Scene;
import com.architecture.diagram.vectorizer.model.scene.SceneElement;
import com.architecture.diagram.vectorizer.model.scene.ShapeElement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a Diagram from a typed raw scene in three strictly ordered passes:
 * 1. Shapes -> nodes (labels from bound text, ids from the identifier assigner)
 * 2. Connectors -> edges (only when both ends map to pass-1 nodes)
 * 3. Frames -> groups (members intersected with the pass-1 node set)
 *
 * Elements that cannot be placed are counted in the {@link ExtractionSummary} and reported as
 * warnings; extraction itself never fails.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExtractionPipeline {

    static final String SOURCE = "excalidraw";
    private static final String DEFAULT_GROUP_NAME = "group";

    private final BindingResolver bindingResolver;
    private final IdentifierAssigner identifierAssigner;

    public ExtractionResult extract(Scene scene) {
        BindingResolution bindings = bindingResolver.resolve(scene);
        List<ConversionWarning> warnings = new ArrayList<>();
        ExtractionSummary summary = new ExtractionSummary();
        summary.setSkippedDeleted((int) scene.getElements().stream().filter(SceneElement::isDeleted).count());

        Map<String, FrameElement> liveFrames = new LinkedHashMap<>();
        for (FrameElement frame : scene.frames()) {
            if (frame.isLive()) {
                liveFrames.put(frame.getId(), frame);
            }
        }

        // Pass 1: shapes
        Map<String, String> nodeIdsByRawId = new LinkedHashMap<>();
        List<DiagramNode> nodes = new ArrayList<>();
        IdRegistry nodeRegistry = extractShapes(scene, bindings, liveFrames, nodeIdsByRawId, nodes, summary, warnings);

        // Pass 2: connectors
        List<DiagramEdge> edges = extractConnectors(scene, bindings, nodeIdsByRawId, summary, warnings);

        // Pass 3: frames
        List<DiagramGroup> groups = extractFrames(bindings, liveFrames, nodeIdsByRawId, nodeRegistry);

        for (String textId : bindings.getUnattachedTexts()) {
            warnings.add(ConversionWarning.unresolvedBinding(textId, "Text is not attached to any shape"));
        }
        summary.setUnattachedText(bindings.getUnattachedTexts().size());
        summary.setNodeCount(nodes.size());
        summary.setEdgeCount(edges.size());
        summary.setGroupCount(groups.size());

        boolean hasDecision = nodes.stream().anyMatch(node -> node.getType() == NodeType.DIAMOND);
        Diagram diagram = Diagram.builder()
                .diagramType(hasDecision ? DiagramType.FLOWCHART : DiagramType.ARCHITECTURE)
                .source(SOURCE)
                .nodes(nodes)
                .edges(edges)
                .groups(groups)
                .build();

        log.info("Extracted diagram: {} nodes, {} edges, {} groups ({} connectors dropped, {} shapes unmapped, {} text unattached)",
                summary.getNodeCount(), summary.getEdgeCount(), summary.getGroupCount(),
                summary.getDroppedConnectors(), summary.getUnmappedShapes(), summary.getUnattachedText());
        return new ExtractionResult(diagram, summary, List.copyOf(warnings));
    }

    // ========================= PASS 1: SHAPES =========================

    private IdRegistry extractShapes(Scene scene, BindingResolution bindings, Map<String, FrameElement> liveFrames,
                                     Map<String, String> nodeIdsByRawId, List<DiagramNode> nodes,
                                     ExtractionSummary summary, List<ConversionWarning> warnings) {
        List<ShapeElement> shapes = new ArrayList<>();
        for (ShapeElement shape : scene.shapes()) {
            if (shape.isLive()) {
                shapes.add(shape);
            }
        }

        Map<String, String> labels = new HashMap<>();
        Map<String, Integer> tokenCounts = new HashMap<>();
        for (ShapeElement shape : shapes) {
            String label = labelOf(shape, bindings);
            labels.put(shape.getId(), label);
            if (!label.isEmpty()) {
                tokenCounts.merge(identifierAssigner.normalize(label), 1, Integer::sum);
            }
        }

        IdRegistry registry = IdRegistry.empty();
        for (ShapeElement shape : shapes) {
            String label = labels.get(shape.getId());
            String context = contextOf(shape, bindings, liveFrames);
            boolean ambiguous = !label.isEmpty() && tokenCounts.getOrDefault(identifierAssigner.normalize(label), 0) > 1;

            IdAssignment assignment = ambiguous && context != null
                    ? identifierAssigner.assignQualified(label, context, registry)
                    : identifierAssigner.assign(label, context, registry);
            registry = assignment.getRegistry();
            nodeIdsByRawId.put(shape.getId(), assignment.getId());

            NodeType type = NodeType.fromString(shape.getRawType());
            if (type == null) {
                log.warn("Unsupported shape kind '{}' on element {}, using rectangle", shape.getRawType(), shape.getId());
                warnings.add(ConversionWarning.unsupportedShape(shape.getId(),
                        "Shape kind '" + shape.getRawType() + "' mapped to rectangle"));
                summary.setUnmappedShapes(summary.getUnmappedShapes() + 1);
                type = NodeType.RECTANGLE;
            }

            long width = Math.round(shape.getBounds().getWidth());
            long height = Math.round(shape.getBounds().getHeight());
            nodes.add(DiagramNode.builder()
                    .id(assignment.getId())
                    .type(type)
                    .label(label)
                    .x((double) Math.round(shape.getBounds().getX()))
                    .y((double) Math.round(shape.getBounds().getY()))
                    .width(width > 0 ? width : DiagramNode.DEFAULT_WIDTH)
                    .height(height > 0 ? height : DiagramNode.DEFAULT_HEIGHT)
                    .style(styleOf(shape))
                    .confidence(1.0)
                    .build());
        }
        return registry;
    }

    private String labelOf(ShapeElement shape, BindingResolution bindings) {
        String bound = bindings.labelFor(shape.getId());
        if (!bound.isEmpty()) {
            return bound;
        }
        return shape.getText() != null ? shape.getText().strip() : "";
    }

    private String contextOf(SceneElement element, BindingResolution bindings, Map<String, FrameElement> liveFrames) {
        return bindings.nearestFrameOf(element.getId())
                .map(liveFrames::get)
                .map(FrameElement::getName)
                .orElse(null);
    }

    private NodeStyle styleOf(ShapeElement shape) {
        NodeStyle style = NodeStyle.builder()
                .fillColor(shape.getFillColor())
                .strokeColor(shape.getStrokeColor())
                .strokeWidth(shape.getStrokeWidth())
                .build();
        return style.isEmpty() ? null : style;
    }

    // ========================= PASS 2: CONNECTORS =========================

    private List<DiagramEdge> extractConnectors(Scene scene, BindingResolution bindings,
                                                Map<String, String> nodeIdsByRawId,
                                                ExtractionSummary summary, List<ConversionWarning> warnings) {
        List<DiagramEdge> edges = new ArrayList<>();
        IdRegistry registry = IdRegistry.empty();

        for (ConnectorElement connector : scene.connectors()) {
            if (connector.isDeleted()) {
                continue;
            }
            ConnectorBinding binding = bindings.bindingFor(connector.getId())
                    .orElse(new ConnectorBinding(null, null));
            String from = binding.getStartId() != null ? nodeIdsByRawId.get(binding.getStartId()) : null;
            String to = binding.getEndId() != null ? nodeIdsByRawId.get(binding.getEndId()) : null;

            if (from == null || to == null) {
                log.warn("Dropping connector {}: endpoints {} -> {} do not resolve to nodes",
                        connector.getId(), binding.getStartId(), binding.getEndId());
                warnings.add(ConversionWarning.unresolvedBinding(connector.getId(),
                        bindings.getUnresolvedConnectors().contains(connector.getId())
                                ? "Connector endpoints do not both resolve to shapes"
                                : "Connector is bound to a shape that is not part of the diagram"));
                summary.setDroppedConnectors(summary.getDroppedConnectors() + 1);
                continue;
            }

            IdAssignment assignment = identifierAssigner.assignEdge(from, to, registry);
            registry = assignment.getRegistry();

            String label = bindings.labelFor(connector.getId());
            StrokeStyle strokeStyle = connector.getStrokeStyle();
            edges.add(DiagramEdge.builder()
                    .id(assignment.getId())
                    .from(from)
                    .to(to)
                    .type(connector.isArrow() ? EdgeType.ARROW : EdgeType.LINE)
                    .label(label.isEmpty() ? null : label)
                    .style(strokeStyle != StrokeStyle.SOLID ? EdgeStyle.of(strokeStyle) : null)
                    .confidence(1.0)
                    .build());
        }
        return edges;
    }

    // ========================= PASS 3: FRAMES =========================

    private List<DiagramGroup> extractFrames(BindingResolution bindings, Map<String, FrameElement> liveFrames,
                                             Map<String, String> nodeIdsByRawId, IdRegistry nodeRegistry) {
        List<DiagramGroup> groups = new ArrayList<>();
        IdRegistry registry = nodeRegistry;

        for (FrameElement frame : liveFrames.values()) {
            List<String> members = new ArrayList<>();
            for (Map.Entry<String, String> entry : nodeIdsByRawId.entrySet()) {
                if (bindings.framesOf(entry.getKey()).contains(frame.getId())) {
                    members.add(entry.getValue());
                }
            }
            if (members.isEmpty()) {
                log.debug("Frame {} has no surviving members, no group emitted", frame.getId());
                continue;
            }

            String name = frame.getName() != null && !frame.getName().isBlank() ? frame.getName().strip() : null;
            IdAssignment assignment = identifierAssigner.assign(name != null ? name : DEFAULT_GROUP_NAME, null, registry);
            registry = assignment.getRegistry();

            groups.add(DiagramGroup.builder()
                    .id(assignment.getId())
                    .label(name)
                    .nodeIds(members)
                    .build());
        }
        return groups;
    }
}
