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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Emits a Mermaid flowchart.
 *
 * Layout: ungrouped node declarations, then one {@code subgraph ... end} block per group holding
 * its members' declarations, then edges, then {@code style} lines. A node that belongs to several
 * groups is declared in each of them. Mermaid has no coordinates; positional mode only picks the
 * flow direction from the aspect ratio of the source layout.
 */
@Component
public class MermaidEmitter implements FormatEmitter {

    private static final String INDENT = "    ";
    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern PLAIN_TITLE = Pattern.compile("[A-Za-z0-9 _.,()/-]*");
    private static final Set<String> RESERVED = Set.of("end", "graph", "flowchart", "subgraph", "style",
            "classdef", "class", "click", "linkstyle", "direction");

    private static final Map<NodeType, String[]> SHAPES = new EnumMap<>(NodeType.class);

    static {
        SHAPES.put(NodeType.RECTANGLE, new String[]{"[\"", "\"]"});
        SHAPES.put(NodeType.DIAMOND, new String[]{"{\"", "\"}"});
        SHAPES.put(NodeType.ELLIPSE, new String[]{"([\"", "\"])"});
        SHAPES.put(NodeType.CIRCLE, new String[]{"((\"", "\"))"});
        SHAPES.put(NodeType.CYLINDER, new String[]{"[(\"", "\")]"});
        SHAPES.put(NodeType.PARALLELOGRAM, new String[]{"[/\"", "\"/]"});
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.MERMAID;
    }

    @Override
    public String emit(Diagram diagram, LayoutMode layoutMode) {
        Map<String, String> ids = aliasIds(diagram);
        List<String> lines = new ArrayList<>();

        if (diagram.hasTitle()) {
            lines.add("---");
            lines.add("title: " + title(diagram.getTitle()));
            lines.add("---");
        }
        lines.add("flowchart " + direction(diagram, layoutMode));

        Set<String> grouped = new HashSet<>();
        for (DiagramGroup group : diagram.getGroups()) {
            grouped.addAll(group.getNodeIds());
        }

        for (DiagramNode node : diagram.getNodes()) {
            if (!grouped.contains(node.getId())) {
                lines.add(INDENT + declaration(node, ids));
            }
        }

        Map<String, DiagramNode> nodesById = diagram.getNodesById();
        for (DiagramGroup group : diagram.getGroups()) {
            lines.add("");
            String label = group.getLabel();
            lines.add(INDENT + "subgraph " + ids.get(group.getId())
                    + (label != null && !label.isEmpty() ? "[\"" + escape(label) + "\"]" : ""));
            for (String nodeId : group.getNodeIds()) {
                DiagramNode node = nodesById.get(nodeId);
                if (node != null) {
                    lines.add(INDENT + INDENT + declaration(node, ids));
                }
            }
            lines.add(INDENT + "end");
        }

        if (!diagram.getEdges().isEmpty()) {
            lines.add("");
        }
        for (DiagramEdge edge : diagram.getEdges()) {
            String connector = connector(edge);
            String from = ids.get(edge.getFrom());
            String to = ids.get(edge.getTo());
            if (edge.hasLabel()) {
                lines.add(INDENT + from + " " + connector + "|\"" + escape(edge.getLabel()) + "\"| " + to);
            } else {
                lines.add(INDENT + from + " " + connector + " " + to);
            }
        }

        List<String> styleLines = new ArrayList<>();
        for (DiagramNode node : diagram.getNodes()) {
            String style = style(node.getStyle());
            if (style != null) {
                styleLines.add(INDENT + "style " + ids.get(node.getId()) + " " + style);
            }
        }
        if (!styleLines.isEmpty()) {
            lines.add("");
            lines.addAll(styleLines);
        }

        return String.join("\n", lines) + "\n";
    }

    private String declaration(DiagramNode node, Map<String, String> ids) {
        String[] shape = SHAPES.getOrDefault(node.getType(), SHAPES.get(NodeType.RECTANGLE));
        return ids.get(node.getId()) + shape[0] + escape(node.getLabel()) + shape[1];
    }

    private String connector(DiagramEdge edge) {
        boolean broken = edge.getStrokeStyle() != StrokeStyle.SOLID;
        if (edge.getType() == EdgeType.LINE) {
            return broken ? "-.-" : "---";
        }
        return broken ? "-.->" : "-->";
    }

    private String direction(Diagram diagram, LayoutMode layoutMode) {
        if (layoutMode != LayoutMode.POSITIONAL || diagram.getNodes().isEmpty()) {
            return "TD";
        }
        double minX = Double.MAX_VALUE, maxX = -Double.MAX_VALUE;
        double minY = Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (DiagramNode node : diagram.getNodes()) {
            minX = Math.min(minX, node.getLayoutX());
            maxX = Math.max(maxX, node.getLayoutX());
            minY = Math.min(minY, node.getLayoutY());
            maxY = Math.max(maxY, node.getLayoutY());
        }
        return (maxX - minX) > (maxY - minY) ? "LR" : "TD";
    }

    private String style(NodeStyle style) {
        if (style == null || style.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (style.getFillColor() != null) {
            parts.add("fill:" + style.getFillColor());
        }
        if (style.getStrokeColor() != null) {
            parts.add("stroke:" + style.getStrokeColor());
        }
        if (style.getStrokeWidth() != null) {
            parts.add("stroke-width:" + EmitterSupport.number(style.getStrokeWidth()) + "px");
        }
        return String.join(",", parts);
    }

    /**
     * Escape text placed inside a quoted Mermaid label using Mermaid entity codes.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("#", "#35;")
                .replace("\"", "#quot;")
                .replace("\r", "")
                .replace("\n", "<br/>");
    }

    private String title(String title) {
        if (PLAIN_TITLE.matcher(title).matches()) {
            return title;
        }
        return "\"" + title.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ") + "\"";
    }

    /**
     * Map node and group ids to identifiers Mermaid accepts. Plain ids map to themselves;
     * others are sanitized and numbered deterministically in diagram order.
     */
    private Map<String, String> aliasIds(Diagram diagram) {
        List<String> all = new ArrayList<>();
        diagram.getNodes().forEach(node -> all.add(node.getId()));
        diagram.getGroups().forEach(group -> all.add(group.getId()));

        Map<String, String> aliases = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (String id : all) {
            if (isPlain(id)) {
                aliases.put(id, id);
                used.add(id);
            }
        }
        for (String id : all) {
            if (aliases.containsKey(id)) {
                continue;
            }
            String base = UNSAFE_ID_CHARS.matcher(id).replaceAll("_");
            if (base.isEmpty() || !Character.isLetter(base.charAt(0)) && base.charAt(0) != '_') {
                base = "n_" + base;
            }
            if (RESERVED.contains(base.toLowerCase(Locale.ROOT))) {
                base = base + "_node";
            }
            String candidate = base;
            int counter = 2;
            while (used.contains(candidate)) {
                candidate = base + "_" + counter++;
            }
            aliases.put(id, candidate);
            used.add(candidate);
        }
        return aliases;
    }

    private boolean isPlain(String id) {
        return PLAIN_ID.matcher(id).matches() && !RESERVED.contains(id.toLowerCase(Locale.ROOT));
    }
}
