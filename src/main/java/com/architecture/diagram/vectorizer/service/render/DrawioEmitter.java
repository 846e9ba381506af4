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

import java.util.HashMap;
import java.util.Map;

/**
 * Emits a draw.io (mxGraph) document.
 *
 * Cells: root cells {@code 0} and {@code 1}, then one container cell per group ({@code group-<id>}),
 * one vertex per node ({@code node-<id>}) and one edge cell per edge ({@code edge-<id>}).
 * Group containers are drawn behind the nodes; nodes stay parented to the default layer because
 * a node may belong to several groups. Geometry coordinates are only written in positional mode.
 */
@Component
public class DrawioEmitter implements FormatEmitter {

    private static final double GROUP_PADDING = 20;
    private static final String CELL_INDENT = "        ";

    @Override
    public OutputFormat format() {
        return OutputFormat.DRAWIO;
    }

    @Override
    public String emit(Diagram diagram, LayoutMode layoutMode) {
        boolean positional = layoutMode == LayoutMode.POSITIONAL;
        Map<String, DiagramNode> nodesById = diagram.getNodesById();
        StringBuilder out = new StringBuilder();

        out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        out.append("<mxfile host=\"diagram-to-vector\" type=\"device\">\n");
        out.append("  <diagram name=\"").append(EmitterSupport.xml(diagram.hasTitle() ? diagram.getTitle() : "Page-1"))
                .append("\" id=\"diagram_1\">\n");
        out.append("    <mxGraphModel dx=\"1000\" dy=\"600\" grid=\"1\" gridSize=\"10\">\n");
        out.append("      <root>\n");
        out.append(CELL_INDENT).append("<mxCell id=\"0\"/>\n");
        out.append(CELL_INDENT).append("<mxCell id=\"1\" parent=\"0\"/>\n");

        for (DiagramGroup group : diagram.getGroups()) {
            out.append(CELL_INDENT).append("<mxCell id=\"").append(EmitterSupport.xml("group-" + group.getId()))
                    .append("\" value=\"").append(EmitterSupport.xml(group.getLabel()))
                    .append("\" style=\"").append(EmitterSupport.xml(groupStyle()))
                    .append("\" vertex=\"1\" parent=\"1\">\n");
            out.append(CELL_INDENT).append("  ").append(groupGeometry(group, nodesById, positional)).append("\n");
            out.append(CELL_INDENT).append("</mxCell>\n");
        }

        for (DiagramNode node : diagram.getNodes()) {
            out.append(CELL_INDENT).append("<mxCell id=\"").append(EmitterSupport.xml("node-" + node.getId()))
                    .append("\" value=\"").append(EmitterSupport.xml(node.getLabel()))
                    .append("\" style=\"").append(EmitterSupport.xml(nodeStyle(node)))
                    .append("\" vertex=\"1\" parent=\"1\">\n");
            out.append(CELL_INDENT).append("  ").append(nodeGeometry(node, positional)).append("\n");
            out.append(CELL_INDENT).append("</mxCell>\n");
        }

        for (DiagramEdge edge : diagram.getEdges()) {
            out.append(CELL_INDENT).append("<mxCell id=\"").append(EmitterSupport.xml("edge-" + edge.getId()))
                    .append("\" value=\"").append(EmitterSupport.xml(edge.getLabel()))
                    .append("\" style=\"").append(EmitterSupport.xml(edgeStyle(edge)))
                    .append("\" edge=\"1\" parent=\"1\" source=\"").append(EmitterSupport.xml("node-" + edge.getFrom()))
                    .append("\" target=\"").append(EmitterSupport.xml("node-" + edge.getTo())).append("\">\n");
            out.append(CELL_INDENT).append("  <mxGeometry relative=\"1\" as=\"geometry\"/>\n");
            out.append(CELL_INDENT).append("</mxCell>\n");
        }

        out.append("      </root>\n");
        out.append("    </mxGraphModel>\n");
        out.append("  </diagram>\n");
        out.append("</mxfile>\n");
        return out.toString();
    }

    private String nodeGeometry(DiagramNode node, boolean positional) {
        String size = "width=\"" + EmitterSupport.number(node.getWidth())
                + "\" height=\"" + EmitterSupport.number(node.getHeight()) + "\"";
        if (!positional) {
            return "<mxGeometry " + size + " as=\"geometry\"/>";
        }
        return "<mxGeometry x=\"" + EmitterSupport.number(node.getLayoutX())
                + "\" y=\"" + EmitterSupport.number(node.getLayoutY()) + "\" " + size + " as=\"geometry\"/>";
    }

    private String groupGeometry(DiagramGroup group, Map<String, DiagramNode> nodesById, boolean positional) {
        if (!positional) {
            return "<mxGeometry as=\"geometry\"/>";
        }
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (String nodeId : group.getNodeIds()) {
            DiagramNode node = nodesById.get(nodeId);
            if (node == null) {
                continue;
            }
            minX = Math.min(minX, node.getLayoutX());
            minY = Math.min(minY, node.getLayoutY());
            maxX = Math.max(maxX, node.getLayoutX() + node.getWidth());
            maxY = Math.max(maxY, node.getLayoutY() + node.getHeight());
        }
        if (minX == Double.MAX_VALUE) {
            return "<mxGeometry as=\"geometry\"/>";
        }
        return "<mxGeometry x=\"" + EmitterSupport.number(minX - GROUP_PADDING)
                + "\" y=\"" + EmitterSupport.number(minY - GROUP_PADDING)
                + "\" width=\"" + EmitterSupport.number(maxX - minX + 2 * GROUP_PADDING)
                + "\" height=\"" + EmitterSupport.number(maxY - minY + 2 * GROUP_PADDING)
                + "\" as=\"geometry\"/>";
    }

    private String nodeStyle(DiagramNode node) {
        Map<String, String> style = new HashMap<>();
        style.put("whiteSpace", "wrap");
        String shapeToken = null;

        NodeType type = node.getType() != null ? node.getType() : NodeType.RECTANGLE;
        switch (type) {
            case DIAMOND:
                shapeToken = "rhombus";
                break;
            case CIRCLE:
                shapeToken = "ellipse";
                style.put("aspect", "fixed");
                break;
            case ELLIPSE:
                shapeToken = "ellipse";
                break;
            case CYLINDER:
                style.put("shape", "cylinder3");
                break;
            case PARALLELOGRAM:
                style.put("shape", "parallelogram");
                break;
            default:
                style.put("rounded", "0");
        }

        NodeStyle nodeStyle = node.getStyle();
        if (nodeStyle != null) {
            if (nodeStyle.getFillColor() != null) {
                style.put("fillColor", nodeStyle.getFillColor());
            }
            if (nodeStyle.getStrokeColor() != null) {
                style.put("strokeColor", nodeStyle.getStrokeColor());
            }
            if (nodeStyle.getStrokeWidth() != null) {
                style.put("strokeWidth", EmitterSupport.number(nodeStyle.getStrokeWidth()));
            }
        }
        return styleString(shapeToken, style);
    }

    private String groupStyle() {
        Map<String, String> style = new HashMap<>();
        style.put("container", "1");
        style.put("collapsible", "0");
        style.put("dashed", "1");
        style.put("fillColor", "none");
        style.put("rounded", "1");
        style.put("verticalAlign", "top");
        style.put("align", "left");
        style.put("spacingLeft", "8");
        return styleString(null, style);
    }

    private String edgeStyle(DiagramEdge edge) {
        Map<String, String> style = new HashMap<>();
        style.put("edgeStyle", "orthogonalEdgeStyle");
        style.put("rounded", "0");
        if (edge.getStrokeStyle() == StrokeStyle.DASHED) {
            style.put("dashed", "1");
        } else if (edge.getStrokeStyle() == StrokeStyle.DOTTED) {
            style.put("dashed", "1");
            style.put("dashPattern", "1 4");
        }
        if (edge.getType() == EdgeType.LINE) {
            style.put("endArrow", "none");
        }
        return styleString(null, style);
    }

    /**
     * mxGraph style string: optional leading shape token, then key-sorted {@code key=value;} pairs.
     */
    private String styleString(String shapeToken, Map<String, String> style) {
        String pairs = EmitterSupport.sortedAttributes(style, "=", ";") + ";";
        return shapeToken != null ? shapeToken + ";" + pairs : pairs;
    }
}
