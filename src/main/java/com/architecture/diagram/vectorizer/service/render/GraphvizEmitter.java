package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.model.diagram.DiagramEdge;
import com.architecture.diagram.vectorizer.model.diagram.DiagramGroup;
import com.architecture.diagram.vectorizer.model.diagram.DiagramNode;
import com.architecture.diagram.vectorizer.model.diagram.EdgeType;
import com.architecture.diagram.vectorizer.model.diagram.NodeStyle;
import com.architecture.diagram.vectorizer.model.diagram.NodeType;
import com.architecture.diagram.vectorizer.model.diagram.StrokeStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Emits a GraphViz digraph. Node and edge attribute lists are key-sorted; each group becomes a
 * {@code subgraph cluster_<id>}. Positional mode pins nodes with {@code pos="x,y!"} and sizes them
 * in inches, GraphViz's unit for node width and height.
 */
@Component
public class GraphvizEmitter implements FormatEmitter {

    private static final String INDENT = "    ";
    private static final double POINTS_PER_INCH = 72;
    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    private static final Map<NodeType, String> SHAPES = new EnumMap<>(NodeType.class);

    static {
        SHAPES.put(NodeType.RECTANGLE, "box");
        SHAPES.put(NodeType.DIAMOND, "diamond");
        SHAPES.put(NodeType.CIRCLE, "circle");
        SHAPES.put(NodeType.ELLIPSE, "ellipse");
        SHAPES.put(NodeType.CYLINDER, "cylinder");
        SHAPES.put(NodeType.PARALLELOGRAM, "parallelogram");
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.GRAPHVIZ;
    }

    @Override
    public String emit(Diagram diagram, LayoutMode layoutMode) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph G {");
        if (diagram.hasTitle()) {
            lines.add(INDENT + "label=" + quote(diagram.getTitle()) + ";");
            lines.add(INDENT + "labelloc=t;");
        }
        lines.add(INDENT + "rankdir=TB;");
        lines.add("");

        for (DiagramNode node : diagram.getNodes()) {
            lines.add(INDENT + id(node.getId()) + " [" + nodeAttributes(node, layoutMode) + "];");
        }

        if (!diagram.getEdges().isEmpty()) {
            lines.add("");
        }
        for (DiagramEdge edge : diagram.getEdges()) {
            Map<String, String> attributes = edgeAttributes(edge);
            String attributeList = attributes.isEmpty()
                    ? ""
                    : " [" + EmitterSupport.sortedAttributes(attributes, "=", ", ") + "]";
            lines.add(INDENT + id(edge.getFrom()) + " -> " + id(edge.getTo()) + attributeList + ";");
        }

        for (DiagramGroup group : diagram.getGroups()) {
            lines.add("");
            lines.add(INDENT + "subgraph " + id("cluster_" + group.getId()) + " {");
            if (group.getLabel() != null && !group.getLabel().isEmpty()) {
                lines.add(INDENT + INDENT + "label=" + quote(group.getLabel()) + ";");
            }
            for (String nodeId : group.getNodeIds()) {
                lines.add(INDENT + INDENT + id(nodeId) + ";");
            }
            lines.add(INDENT + "}");
        }

        lines.add("}");
        return String.join("\n", lines) + "\n";
    }

    private String nodeAttributes(DiagramNode node, LayoutMode layoutMode) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("label", quote(node.getLabel()));
        attributes.put("shape", SHAPES.getOrDefault(node.getType(), "box"));

        NodeStyle style = node.getStyle();
        if (style != null) {
            if (style.getFillColor() != null) {
                attributes.put("fillcolor", quote(style.getFillColor()));
                attributes.put("style", "filled");
            }
            if (style.getStrokeColor() != null) {
                attributes.put("color", quote(style.getStrokeColor()));
            }
            if (style.getStrokeWidth() != null) {
                attributes.put("penwidth", EmitterSupport.number(style.getStrokeWidth()));
            }
        }

        if (layoutMode == LayoutMode.POSITIONAL) {
            attributes.put("pos", quote(EmitterSupport.number(node.getLayoutX()) + ","
                    + EmitterSupport.number(node.getLayoutY()) + "!"));
            attributes.put("width", EmitterSupport.number(node.getWidth() / POINTS_PER_INCH));
            attributes.put("height", EmitterSupport.number(node.getHeight() / POINTS_PER_INCH));
        }
        return EmitterSupport.sortedAttributes(attributes, "=", ", ");
    }

    private Map<String, String> edgeAttributes(DiagramEdge edge) {
        Map<String, String> attributes = new HashMap<>();
        if (edge.hasLabel()) {
            attributes.put("label", quote(edge.getLabel()));
        }
        if (edge.getStrokeStyle() == StrokeStyle.DASHED) {
            attributes.put("style", "dashed");
        } else if (edge.getStrokeStyle() == StrokeStyle.DOTTED) {
            attributes.put("style", "dotted");
        }
        if (edge.getType() == EdgeType.LINE) {
            attributes.put("arrowhead", "none");
        }
        return attributes;
    }

    private String id(String id) {
        if (PLAIN_ID.matcher(id).matches() && !KEYWORDS.contains(id.toLowerCase(Locale.ROOT))) {
            return id;
        }
        return quote(id);
    }

    static String quote(String text) {
        String value = text == null ? "" : text;
        return "\"" + value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r", "")
                .replace("\n", "\\n") + "\"";
    }
}
