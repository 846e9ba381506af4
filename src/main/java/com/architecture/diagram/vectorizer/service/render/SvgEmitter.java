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
import java.util.List;
import java.util.Map;

import static com.architecture.diagram.vectorizer.service.render.EmitterSupport.number;
import static com.architecture.diagram.vectorizer.service.render.EmitterSupport.xml;

/**
 * Emits a standalone SVG document with absolutely positioned primitives.
 *
 * SVG is inherently positional, so the layout mode is ignored: node coordinates are always used
 * (0 when absent). Drawing order is groups, then edges, then nodes. Edges are paths clipped to
 * the node outlines, with the arrowhead computed as a polygon at the target end.
 */
@Component
public class SvgEmitter implements FormatEmitter {

    private static final double PADDING = 50;
    private static final double TITLE_BAND = 30;
    private static final double GROUP_PADDING = 20;
    private static final double ARROW_LENGTH = 10;
    private static final double ARROW_HALF_WIDTH = 5;
    private static final double SELF_LOOP_HEIGHT = 40;
    private static final String DEFAULT_FILL = "#ffffff";
    private static final String DEFAULT_STROKE = "#333333";
    private static final String EDGE_COLOR = "#333333";

    @Override
    public OutputFormat format() {
        return OutputFormat.SVG;
    }

    @Override
    public String emit(Diagram diagram, LayoutMode layoutMode) {
        if (diagram.getNodes().isEmpty()) {
            return "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"100\" height=\"100\"></svg>\n";
        }

        Map<String, DiagramNode> nodesById = diagram.getNodesById();
        List<double[]> groupBoxes = new ArrayList<>();
        for (DiagramGroup group : diagram.getGroups()) {
            groupBoxes.add(groupBox(group, nodesById));
        }

        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (DiagramNode node : diagram.getNodes()) {
            minX = Math.min(minX, node.getLayoutX());
            minY = Math.min(minY, node.getLayoutY());
            maxX = Math.max(maxX, node.getLayoutX() + node.getWidth());
            maxY = Math.max(maxY, node.getLayoutY() + node.getHeight());
        }
        for (double[] box : groupBoxes) {
            if (box == null) {
                continue;
            }
            minX = Math.min(minX, box[0]);
            minY = Math.min(minY, box[1]);
            maxX = Math.max(maxX, box[0] + box[2]);
            maxY = Math.max(maxY, box[1] + box[3]);
        }

        double titleBand = diagram.hasTitle() ? TITLE_BAND : 0;
        double width = maxX - minX + PADDING * 2;
        double height = maxY - minY + PADDING * 2 + titleBand;
        double offsetX = -minX + PADDING;
        double offsetY = -minY + PADDING + titleBand;

        StringBuilder out = new StringBuilder();
        out.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(number(width))
                .append("\" height=\"").append(number(height))
                .append("\" viewBox=\"0 0 ").append(number(width)).append(' ').append(number(height)).append("\">\n");

        if (diagram.hasTitle()) {
            out.append("  <title>").append(xml(diagram.getTitle())).append("</title>\n");
            out.append("  <text x=\"").append(number(width / 2)).append("\" y=\"").append(number(PADDING / 2 + 10))
                    .append("\" font-family=\"Arial\" font-size=\"18\" font-weight=\"bold\" text-anchor=\"middle\">")
                    .append(xml(diagram.getTitle())).append("</text>\n");
        }

        if (!diagram.getGroups().isEmpty()) {
            out.append("  <g class=\"groups\">\n");
            for (int i = 0; i < diagram.getGroups().size(); i++) {
                appendGroup(out, diagram.getGroups().get(i), groupBoxes.get(i), offsetX, offsetY);
            }
            out.append("  </g>\n");
        }

        if (!diagram.getEdges().isEmpty()) {
            out.append("  <g class=\"edges\">\n");
            for (DiagramEdge edge : diagram.getEdges()) {
                appendEdge(out, edge, nodesById.get(edge.getFrom()), nodesById.get(edge.getTo()), offsetX, offsetY);
            }
            out.append("  </g>\n");
        }

        out.append("  <g class=\"nodes\">\n");
        for (DiagramNode node : diagram.getNodes()) {
            appendNode(out, node, offsetX, offsetY);
        }
        out.append("  </g>\n");
        out.append("</svg>\n");
        return out.toString();
    }

    // ========================= GROUPS =========================

    private double[] groupBox(DiagramGroup group, Map<String, DiagramNode> nodesById) {
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
            return null;
        }
        return new double[]{minX - GROUP_PADDING, minY - GROUP_PADDING,
                maxX - minX + GROUP_PADDING * 2, maxY - minY + GROUP_PADDING * 2};
    }

    private void appendGroup(StringBuilder out, DiagramGroup group, double[] box, double offsetX, double offsetY) {
        if (box == null) {
            return;
        }
        double x = box[0] + offsetX;
        double y = box[1] + offsetY;
        out.append("    <rect id=\"").append(xml("group-" + group.getId())).append("\" x=\"").append(number(x))
                .append("\" y=\"").append(number(y))
                .append("\" width=\"").append(number(box[2])).append("\" height=\"").append(number(box[3]))
                .append("\" fill=\"none\" stroke=\"#888888\" stroke-width=\"1\" stroke-dasharray=\"6,4\" rx=\"8\"/>\n");
        if (group.getLabel() != null && !group.getLabel().isEmpty()) {
            out.append("    <text x=\"").append(number(x + 8)).append("\" y=\"").append(number(y + 16))
                    .append("\" font-family=\"Arial\" font-size=\"12\" fill=\"#555555\">")
                    .append(xml(group.getLabel())).append("</text>\n");
        }
    }

    // ========================= EDGES =========================

    private void appendEdge(StringBuilder out, DiagramEdge edge, DiagramNode from, DiagramNode to,
                            double offsetX, double offsetY) {
        if (from == null || to == null) {
            return;
        }
        String dash = dashArray(edge.getStrokeStyle());
        String strokeAttributes = "fill=\"none\" stroke=\"" + EDGE_COLOR + "\" stroke-width=\"2\""
                + (dash != null ? " stroke-dasharray=\"" + dash + "\"" : "");
        boolean arrow = edge.getType() != EdgeType.LINE;

        double[] start;
        double[] end;
        double[] approach;      // Point the path arrives from, for the arrowhead direction
        String pathData;
        double[] labelAnchor;

        if (from.getId().equals(to.getId())) {
            double x = from.getLayoutX() + offsetX;
            double y = from.getLayoutY() + offsetY;
            start = new double[]{x + from.getWidth() * 0.75, y};
            end = new double[]{x + from.getWidth() * 0.25, y};
            double[] control1 = {start[0], y - SELF_LOOP_HEIGHT};
            approach = new double[]{end[0], y - SELF_LOOP_HEIGHT};
            pathData = "M " + point(start) + " C " + point(control1) + " " + point(approach) + " " + point(end);
            labelAnchor = new double[]{(start[0] + end[0]) / 2, y - SELF_LOOP_HEIGHT * 0.75};
        } else {
            double[] fromCenter = center(from, offsetX, offsetY);
            double[] toCenter = center(to, offsetX, offsetY);
            start = clip(from, fromCenter, toCenter[0] - fromCenter[0], toCenter[1] - fromCenter[1]);
            end = clip(to, toCenter, fromCenter[0] - toCenter[0], fromCenter[1] - toCenter[1]);
            approach = start;
            pathData = "M " + point(start) + " L " + point(end);
            labelAnchor = new double[]{(start[0] + end[0]) / 2, (start[1] + end[1]) / 2 - 6};
        }

        out.append("    <path id=\"").append(xml("edge-" + edge.getId())).append("\" d=\"").append(pathData)
                .append("\" ").append(strokeAttributes).append("/>\n");

        if (arrow) {
            String head = arrowhead(approach, end);
            if (head != null) {
                out.append("    <polygon points=\"").append(head).append("\" fill=\"").append(EDGE_COLOR).append("\"/>\n");
            }
        }

        if (edge.hasLabel()) {
            out.append("    <text x=\"").append(number(labelAnchor[0])).append("\" y=\"").append(number(labelAnchor[1]))
                    .append("\" font-family=\"Arial\" font-size=\"12\" text-anchor=\"middle\">")
                    .append(xml(edge.getLabel())).append("</text>\n");
        }
    }

    private String dashArray(StrokeStyle strokeStyle) {
        switch (strokeStyle) {
            case DASHED:
                return "8,4";
            case DOTTED:
                return "2,4";
            default:
                return null;
        }
    }

    /**
     * Point where the ray from {@code center} in direction (dx, dy) leaves the node outline.
     */
    private double[] clip(DiagramNode node, double[] center, double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return center;
        }
        double halfWidth = node.getWidth() / 2;
        double halfHeight = node.getHeight() / 2;
        double t;
        NodeType type = node.getType() != null ? node.getType() : NodeType.RECTANGLE;
        switch (type) {
            case ELLIPSE:
            case CIRCLE:
                t = 1 / Math.sqrt(Math.pow(dx / halfWidth, 2) + Math.pow(dy / halfHeight, 2));
                break;
            case DIAMOND:
                t = 1 / (Math.abs(dx) / halfWidth + Math.abs(dy) / halfHeight);
                break;
            default:
                double tx = dx != 0 ? halfWidth / Math.abs(dx) : Double.MAX_VALUE;
                double ty = dy != 0 ? halfHeight / Math.abs(dy) : Double.MAX_VALUE;
                t = Math.min(tx, ty);
        }
        return new double[]{center[0] + dx * t, center[1] + dy * t};
    }

    /**
     * Triangle with its tip at {@code tip}, pointing away from {@code from}.
     * Returns null when the direction is undefined.
     */
    private String arrowhead(double[] from, double[] tip) {
        double dx = tip[0] - from[0];
        double dy = tip[1] - from[1];
        double length = Math.hypot(dx, dy);
        if (length == 0) {
            return null;
        }
        double ux = dx / length;
        double uy = dy / length;
        double baseX = tip[0] - ux * ARROW_LENGTH;
        double baseY = tip[1] - uy * ARROW_LENGTH;
        double[] left = {baseX - uy * ARROW_HALF_WIDTH, baseY + ux * ARROW_HALF_WIDTH};
        double[] right = {baseX + uy * ARROW_HALF_WIDTH, baseY - ux * ARROW_HALF_WIDTH};
        return point(tip) + " " + point(left) + " " + point(right);
    }

    // ========================= NODES =========================

    private void appendNode(StringBuilder out, DiagramNode node, double offsetX, double offsetY) {
        double x = node.getLayoutX() + offsetX;
        double y = node.getLayoutY() + offsetY;
        double w = node.getWidth();
        double h = node.getHeight();
        double cx = x + w / 2;
        double cy = y + h / 2;

        NodeStyle style = node.getStyle();
        String fill = style != null && style.getFillColor() != null ? style.getFillColor() : DEFAULT_FILL;
        String stroke = style != null && style.getStrokeColor() != null ? style.getStrokeColor() : DEFAULT_STROKE;
        String strokeWidth = style != null && style.getStrokeWidth() != null ? number(style.getStrokeWidth()) : "2";
        String paint = "fill=\"" + xml(fill) + "\" stroke=\"" + xml(stroke) + "\" stroke-width=\"" + strokeWidth + "\"";
        String id = xml("node-" + node.getId());

        NodeType type = node.getType() != null ? node.getType() : NodeType.RECTANGLE;
        switch (type) {
            case ELLIPSE:
            case CIRCLE:
                out.append("    <ellipse id=\"").append(id).append("\" cx=\"").append(number(cx))
                        .append("\" cy=\"").append(number(cy)).append("\" rx=\"").append(number(w / 2))
                        .append("\" ry=\"").append(number(h / 2)).append("\" ").append(paint).append("/>\n");
                break;
            case DIAMOND:
                out.append("    <polygon id=\"").append(id).append("\" points=\"")
                        .append(point(cx, y)).append(' ').append(point(x + w, cy)).append(' ')
                        .append(point(cx, y + h)).append(' ').append(point(x, cy))
                        .append("\" ").append(paint).append("/>\n");
                break;
            case PARALLELOGRAM:
                double skew = w * 0.2;
                out.append("    <polygon id=\"").append(id).append("\" points=\"")
                        .append(point(x + skew, y)).append(' ').append(point(x + w, y)).append(' ')
                        .append(point(x + w - skew, y + h)).append(' ').append(point(x, y + h))
                        .append("\" ").append(paint).append("/>\n");
                break;
            case CYLINDER:
                double ry = Math.min(10, h / 4);
                String rx = number(w / 2);
                out.append("    <path id=\"").append(id).append("\" d=\"M ").append(point(x, y + ry))
                        .append(" A ").append(rx).append(',').append(number(ry)).append(" 0 0 1 ").append(point(x + w, y + ry))
                        .append(" L ").append(point(x + w, y + h - ry))
                        .append(" A ").append(rx).append(',').append(number(ry)).append(" 0 0 1 ").append(point(x, y + h - ry))
                        .append(" Z\" ").append(paint).append("/>\n");
                out.append("    <ellipse cx=\"").append(number(cx)).append("\" cy=\"").append(number(y + ry))
                        .append("\" rx=\"").append(rx).append("\" ry=\"").append(number(ry))
                        .append("\" fill=\"none\" stroke=\"").append(xml(stroke))
                        .append("\" stroke-width=\"").append(strokeWidth).append("\"/>\n");
                break;
            default:
                out.append("    <rect id=\"").append(id).append("\" x=\"").append(number(x))
                        .append("\" y=\"").append(number(y)).append("\" width=\"").append(number(w))
                        .append("\" height=\"").append(number(h)).append("\" rx=\"5\" ").append(paint).append("/>\n");
        }

        appendLabel(out, node.getLabel(), cx, cy);
    }

    private void appendLabel(StringBuilder out, String label, double cx, double cy) {
        if (label == null || label.isEmpty()) {
            return;
        }
        String[] lines = label.replace("\r", "").split("\n", -1);
        double firstBaseline = cy + 5 - (lines.length - 1) * 8.4;
        out.append("    <text x=\"").append(number(cx)).append("\" y=\"").append(number(firstBaseline))
                .append("\" font-family=\"Arial\" font-size=\"14\" text-anchor=\"middle\">");
        if (lines.length == 1) {
            out.append(xml(lines[0]));
        } else {
            for (int i = 0; i < lines.length; i++) {
                out.append("<tspan x=\"").append(number(cx)).append("\" dy=\"").append(i == 0 ? "0" : "1.2em")
                        .append("\">").append(xml(lines[i])).append("</tspan>");
            }
        }
        out.append("</text>\n");
    }

    private double[] center(DiagramNode node, double offsetX, double offsetY) {
        return new double[]{node.getLayoutX() + offsetX + node.getWidth() / 2,
                node.getLayoutY() + offsetY + node.getHeight() / 2};
    }

    private String point(double[] point) {
        return point(point[0], point[1]);
    }

    private String point(double x, double y) {
        return number(x) + "," + number(y);
    }
}
