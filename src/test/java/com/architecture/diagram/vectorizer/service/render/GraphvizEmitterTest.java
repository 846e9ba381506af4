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

class GraphvizEmitterTest {

    private final GraphvizEmitter emitter = new GraphvizEmitter();

    @Test
    void emit_structuralDigraph() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FLOWCHART)
                .node(DiagramNode.builder().id("start").type(NodeType.ELLIPSE).label("Start").x(10.0).y(20.0).build())
                .node(DiagramNode.builder().id("check").type(NodeType.DIAMOND).label("OK?").build())
                .edge(DiagramEdge.builder().id("start_to_check").from("start").to("check").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).isEqualTo("digraph G {\n"
                + "    rankdir=TB;\n"
                + "\n"
                + "    start [label=\"Start\", shape=ellipse];\n"
                + "    check [label=\"OK?\", shape=diamond];\n"
                + "\n"
                + "    start -> check;\n"
                + "}\n");
    }

    @Test
    void emit_positionalPinsNodesInInches() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).label("A").x(100.0).y(200.0).build())
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.POSITIONAL))
                .contains("    a [height=0.83, label=\"A\", pos=\"100,200!\", shape=box, width=1.67];\n");
    }

    @Test
    void emit_styleAttributesAreSorted() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.CYLINDER).label("A")
                        .style(NodeStyle.builder().fillColor("#ffffff").strokeColor("#000000").strokeWidth(2.0).build())
                        .build())
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.STRUCTURAL)).contains(
                "    a [color=\"#000000\", fillcolor=\"#ffffff\", label=\"A\", penwidth=2, shape=cylinder, style=filled];\n");
    }

    @Test
    void emit_edgeAttributes() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).label("A").build())
                .node(DiagramNode.builder().id("b").type(NodeType.RECTANGLE).label("B").build())
                .edge(DiagramEdge.builder().id("e1").from("a").to("b").type(EdgeType.LINE).label("link").build())
                .edge(DiagramEdge.builder().id("e2").from("b").to("a").style(EdgeStyle.of(StrokeStyle.DOTTED)).build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("    a -> b [arrowhead=none, label=\"link\"];\n")
                .contains("    b -> a [style=dotted];\n");
    }

    @Test
    void emit_titleAndClusters() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.ARCHITECTURE)
                .title("System")
                .node(DiagramNode.builder().id("api").type(NodeType.RECTANGLE).label("API").build())
                .node(DiagramNode.builder().id("db").type(NodeType.CYLINDER).label("DB").build())
                .group(DiagramGroup.builder().id("backend").label("Backend").nodeId("api").nodeId("db").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).startsWith("digraph G {\n    label=\"System\";\n    labelloc=t;\n    rankdir=TB;\n");
        assertThat(output).contains("    subgraph cluster_backend {\n"
                + "        label=\"Backend\";\n"
                + "        api;\n"
                + "        db;\n"
                + "    }\n");
    }

    @Test
    void emit_quotesKeywordAndNonPlainIds() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("node").type(NodeType.RECTANGLE).label("say \"hi\"").build())
                .node(DiagramNode.builder().id("my-svc").type(NodeType.RECTANGLE).label("a\\b").build())
                .edge(DiagramEdge.builder().id("e").from("node").to("my-svc").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("    \"node\" [label=\"say \\\"hi\\\"\", shape=box];\n")
                .contains("    \"my-svc\" [label=\"a\\\\b\", shape=box];\n")
                .contains("    \"node\" -> \"my-svc\";\n");
    }
}
