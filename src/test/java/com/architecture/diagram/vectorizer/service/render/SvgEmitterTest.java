package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.model.diagram.DiagramEdge;
import com.architecture.diagram.vectorizer.model.diagram.DiagramGroup;
import com.architecture.diagram.vectorizer.model.diagram.DiagramNode;
import com.architecture.diagram.vectorizer.model.diagram.DiagramType;
import com.architecture.diagram.vectorizer.model.diagram.EdgeStyle;
import com.architecture.diagram.vectorizer.model.diagram.EdgeType;
import com.architecture.diagram.vectorizer.model.diagram.NodeType;
import com.architecture.diagram.vectorizer.model.diagram.StrokeStyle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SvgEmitterTest {

    private final SvgEmitter emitter = new SvgEmitter();

    @Test
    void emit_emptyDiagram() {
        Diagram empty = Diagram.builder().diagramType(DiagramType.FREEFORM).build();

        assertThat(emitter.emit(empty, LayoutMode.POSITIONAL))
                .isEqualTo("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"100\" height=\"100\"></svg>\n");
    }

    @Test
    void emit_canvasAndEdgeGeometry() {
        String output = emitter.emit(twoNodes(EdgeType.ARROW, StrokeStyle.SOLID), LayoutMode.POSITIONAL);

        assertThat(output).startsWith(
                "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"520\" height=\"160\" viewBox=\"0 0 520 160\">\n");
        assertThat(output).contains("<rect id=\"node-a\" x=\"50\" y=\"50\" width=\"120\" height=\"60\" rx=\"5\"");
        assertThat(output).contains("<path id=\"edge-a_to_b\" d=\"M 170,80 L 350,80\"");
        assertThat(output).contains("<polygon points=\"350,80 340,85 340,75\"");
        assertThat(output).endsWith("</svg>\n");
    }

    @Test
    void emit_linesHaveNoArrowheadAndDashesFollowStroke() {
        String dashedLine = emitter.emit(twoNodes(EdgeType.LINE, StrokeStyle.DASHED), LayoutMode.POSITIONAL);
        String dottedArrow = emitter.emit(twoNodes(EdgeType.ARROW, StrokeStyle.DOTTED), LayoutMode.POSITIONAL);

        assertThat(dashedLine).doesNotContain("<polygon points=").contains("stroke-dasharray=\"8,4\"");
        assertThat(dottedArrow).contains("<polygon points=").contains("stroke-dasharray=\"2,4\"");
    }

    @Test
    void emit_ignoresLayoutMode() {
        Diagram diagram = twoNodes(EdgeType.ARROW, StrokeStyle.SOLID);

        assertThat(emitter.emit(diagram, LayoutMode.STRUCTURAL)).isEqualTo(emitter.emit(diagram, LayoutMode.POSITIONAL));
    }

    @Test
    void emit_drawsGroupsThenEdgesThenNodes() {
        Diagram diagram = twoNodes(EdgeType.ARROW, StrokeStyle.SOLID).toBuilder()
                .group(DiagramGroup.builder().id("pair").label("Pair").nodeId("a").nodeId("b").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).contains("<rect id=\"group-pair\"").contains(">Pair</text>");
        assertThat(output.indexOf("class=\"groups\"")).isLessThan(output.indexOf("class=\"edges\""));
        assertThat(output.indexOf("class=\"edges\"")).isLessThan(output.indexOf("class=\"nodes\""));
    }

    @Test
    void emit_shapePrimitivesAndMultilineLabels() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("e").type(NodeType.ELLIPSE).label("One\nTwo").x(0.0).y(0.0).build())
                .node(DiagramNode.builder().id("d").type(NodeType.DIAMOND).x(200.0).y(0.0).build())
                .node(DiagramNode.builder().id("c").type(NodeType.CYLINDER).x(400.0).y(0.0).build())
                .node(DiagramNode.builder().id("p").type(NodeType.PARALLELOGRAM).x(600.0).y(0.0).build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).contains("<ellipse id=\"node-e\"")
                .contains("<polygon id=\"node-d\"")
                .contains("<path id=\"node-c\"")
                .contains("<polygon id=\"node-p\"")
                .contains("<tspan x=\"110\" dy=\"0\">One</tspan><tspan x=\"110\" dy=\"1.2em\">Two</tspan>");
    }

    @Test
    void emit_selfLoopUsesCurve() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).x(0.0).y(0.0).build())
                .edge(DiagramEdge.builder().id("a_to_a").from("a").to("a").build())
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.POSITIONAL)).contains("<path id=\"edge-a_to_a\" d=\"M 140,50 C ");
    }

    @Test
    void emit_titleAddsHeaderBand() {
        Diagram diagram = twoNodes(EdgeType.ARROW, StrokeStyle.SOLID).toBuilder().title("Flow & Co").build();

        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).contains("height=\"190\"").contains("<title>Flow &amp; Co</title>");
        assertThat(output).contains("<rect id=\"node-a\" x=\"50\" y=\"80\"");
    }

    private Diagram twoNodes(EdgeType type, StrokeStyle strokeStyle) {
        return Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).label("A").x(0.0).y(0.0).build())
                .node(DiagramNode.builder().id("b").type(NodeType.RECTANGLE).label("B").x(300.0).y(0.0).build())
                .edge(DiagramEdge.builder().id("a_to_b").from("a").to("b").type(type)
                        .style(EdgeStyle.of(strokeStyle)).build())
                .build();
    }
}
