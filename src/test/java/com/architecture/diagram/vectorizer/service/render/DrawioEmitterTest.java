package com.architecture.diagram.vectorizer.service.render;

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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DrawioEmitterTest {

    private final DrawioEmitter emitter = new DrawioEmitter();

    private final Diagram diagram = Diagram.builder()
            .diagramType(DiagramType.ARCHITECTURE)
            .node(DiagramNode.builder().id("api").type(NodeType.RECTANGLE).label("API").x(100.0).y(200.0)
                    .style(NodeStyle.builder().fillColor("#a5d8ff").strokeColor("#1971c2").build())
                    .build())
            .node(DiagramNode.builder().id("db").type(NodeType.DIAMOND).label("A & <B>").x(300.0).y(200.0).build())
            .edge(DiagramEdge.builder().id("api_to_db").from("api").to("db").build())
            .group(DiagramGroup.builder().id("backend").label("Backend").nodeId("api").nodeId("db").build())
            .build();

    @Test
    void emit_positionalCarriesCoordinates() {
        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).contains("<mxGeometry x=\"100\" y=\"200\" width=\"120\" height=\"60\" as=\"geometry\"/>");
        assertThat(output).contains("<mxGeometry x=\"80\" y=\"180\" width=\"360\" height=\"100\" as=\"geometry\"/>");
    }

    @Test
    void emit_structuralOmitsCoordinates() {
        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("<mxGeometry width=\"120\" height=\"60\" as=\"geometry\"/>");
        assertThat(output).doesNotContain(" x=\"100\"").doesNotContain(" y=\"200\"");
    }

    @Test
    void emit_stableCellIdsAndDocumentShape() {
        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<mxfile host=\"diagram-to-vector\"");
        assertThat(output).contains("<mxCell id=\"0\"/>", "<mxCell id=\"1\" parent=\"0\"/>");
        assertThat(output).contains("<mxCell id=\"edge-api_to_db\" value=\"\" style=\"");
        assertThat(output).contains("edge=\"1\" parent=\"1\" source=\"node-api\" target=\"node-db\">");
        assertThat(output.indexOf("id=\"group-backend\"")).isLessThan(output.indexOf("id=\"node-api\""));
        assertThat(output.indexOf("id=\"node-db\"")).isLessThan(output.indexOf("id=\"edge-api_to_db\""));
        assertThat(output).endsWith("</mxfile>\n");
    }

    @Test
    void emit_styleStringsAreKeySorted() {
        String output = emitter.emit(diagram, LayoutMode.POSITIONAL);

        assertThat(output).contains("style=\"fillColor=#a5d8ff;rounded=0;strokeColor=#1971c2;whiteSpace=wrap;\"");
        assertThat(output).contains("style=\"rhombus;whiteSpace=wrap;\"");
        assertThat(output).contains("style=\"edgeStyle=orthogonalEdgeStyle;rounded=0;\"");
    }

    @Test
    void emit_escapesLabels() {
        assertThat(emitter.emit(diagram, LayoutMode.POSITIONAL)).contains("value=\"A &amp; &lt;B&gt;\"");
    }

    @Test
    void emit_edgeStrokeAndLineStyles() {
        Diagram styled = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.CIRCLE).build())
                .node(DiagramNode.builder().id("b").type(NodeType.CYLINDER).build())
                .edge(DiagramEdge.builder().id("e1").from("a").to("b").type(EdgeType.LINE)
                        .style(EdgeStyle.of(StrokeStyle.DASHED)).build())
                .edge(DiagramEdge.builder().id("e2").from("b").to("a")
                        .style(EdgeStyle.of(StrokeStyle.DOTTED)).build())
                .build();

        String output = emitter.emit(styled, LayoutMode.STRUCTURAL);

        assertThat(output).contains("style=\"ellipse;aspect=fixed;whiteSpace=wrap;\"");
        assertThat(output).contains("style=\"shape=cylinder3;whiteSpace=wrap;\"");
        assertThat(output).contains("style=\"dashed=1;edgeStyle=orthogonalEdgeStyle;endArrow=none;rounded=0;\"");
        assertThat(output).contains("style=\"dashPattern=1 4;dashed=1;edgeStyle=orthogonalEdgeStyle;rounded=0;\"");
    }

    @Test
    void emit_isDeterministic() {
        assertThat(emitter.emit(diagram, LayoutMode.POSITIONAL)).isEqualTo(emitter.emit(diagram, LayoutMode.POSITIONAL));
    }
}
