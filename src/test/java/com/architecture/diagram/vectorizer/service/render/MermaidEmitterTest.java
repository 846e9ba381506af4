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

class MermaidEmitterTest {

    private final MermaidEmitter emitter = new MermaidEmitter();

    @Test
    void emit_simpleFlowchart() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FLOWCHART)
                .node(node("start", NodeType.ELLIPSE, "Start"))
                .node(node("check", NodeType.DIAMOND, "OK?"))
                .edge(edge("start", "check"))
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).isEqualTo("flowchart TD\n"
                + "    start([\"Start\"])\n"
                + "    check{\"OK?\"}\n"
                + "\n"
                + "    start --> check\n");
    }

    @Test
    void emit_groupsBecomeSubgraphs() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.ARCHITECTURE)
                .node(node("client", NodeType.RECTANGLE, "Client"))
                .node(node("api", NodeType.RECTANGLE, "API"))
                .node(node("db", NodeType.CYLINDER, "DB"))
                .edge(edge("client", "api"))
                .edge(edge("api", "db"))
                .group(DiagramGroup.builder().id("backend").label("Backend").nodeId("api").nodeId("db").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).isEqualTo("flowchart TD\n"
                + "    client[\"Client\"]\n"
                + "\n"
                + "    subgraph backend[\"Backend\"]\n"
                + "        api[\"API\"]\n"
                + "        db[(\"DB\")]\n"
                + "    end\n"
                + "\n"
                + "    client --> api\n"
                + "    api --> db\n");
    }

    @Test
    void emit_nodeInTwoGroupsIsDeclaredInBoth() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.ARCHITECTURE)
                .node(node("svc", NodeType.RECTANGLE, "Svc"))
                .group(DiagramGroup.builder().id("region").nodeId("svc").build())
                .group(DiagramGroup.builder().id("zone").nodeId("svc").build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("    subgraph region\n        svc[\"Svc\"]\n    end");
        assertThat(output).contains("    subgraph zone\n        svc[\"Svc\"]\n    end");
    }

    @Test
    void emit_titleAsFrontMatter() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FLOWCHART)
                .title("Pipeline")
                .node(node("a", NodeType.RECTANGLE, "A"))
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.STRUCTURAL))
                .startsWith("---\ntitle: Pipeline\n---\nflowchart TD\n");
    }

    @Test
    void emit_escapesLabels() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(node("a", NodeType.RECTANGLE, "Say \"hi\" #1\nnow"))
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.STRUCTURAL))
                .contains("a[\"Say #quot;hi#quot; #35;1<br/>now\"]");
    }

    @Test
    void emit_edgeConnectorsFollowTypeAndStroke() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(node("a", NodeType.RECTANGLE, "A"))
                .node(node("b", NodeType.RECTANGLE, "B"))
                .edge(DiagramEdge.builder().id("e1").from("a").to("b").label("calls").build())
                .edge(DiagramEdge.builder().id("e2").from("a").to("b").style(EdgeStyle.of(StrokeStyle.DASHED)).build())
                .edge(DiagramEdge.builder().id("e3").from("a").to("b").type(EdgeType.LINE).build())
                .edge(DiagramEdge.builder().id("e4").from("a").to("b").type(EdgeType.LINE)
                        .style(EdgeStyle.of(StrokeStyle.DOTTED)).build())
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("    a -->|\"calls\"| b\n")
                .contains("    a -.-> b\n")
                .contains("    a --- b\n")
                .contains("    a -.- b\n");
    }

    @Test
    void emit_aliasesReservedAndNonPlainIds() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FLOWCHART)
                .node(node("end", NodeType.ELLIPSE, "End"))
                .node(node("my-node", NodeType.RECTANGLE, "Mine"))
                .edge(edge("my-node", "end"))
                .build();

        String output = emitter.emit(diagram, LayoutMode.STRUCTURAL);

        assertThat(output).contains("    end_node([\"End\"])")
                .contains("    my_node[\"Mine\"]")
                .contains("    my_node --> end_node");
    }

    @Test
    void emit_styleLines() {
        Diagram diagram = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).label("A")
                        .style(NodeStyle.builder().fillColor("#ff0000").strokeColor("#000000").strokeWidth(2.0).build())
                        .build())
                .build();

        assertThat(emitter.emit(diagram, LayoutMode.STRUCTURAL))
                .endsWith("\n    style a fill:#ff0000,stroke:#000000,stroke-width:2px\n");
    }

    @Test
    void emit_positionalPicksDirectionFromAspectRatio() {
        Diagram wide = Diagram.builder()
                .diagramType(DiagramType.FREEFORM)
                .node(DiagramNode.builder().id("a").type(NodeType.RECTANGLE).x(0.0).y(0.0).build())
                .node(DiagramNode.builder().id("b").type(NodeType.RECTANGLE).x(500.0).y(50.0).build())
                .build();

        assertThat(emitter.emit(wide, LayoutMode.POSITIONAL)).startsWith("flowchart LR\n");
        assertThat(emitter.emit(wide, LayoutMode.STRUCTURAL)).startsWith("flowchart TD\n");
    }

    private DiagramNode node(String id, NodeType type, String label) {
        return DiagramNode.builder().id(id).type(type).label(label).build();
    }

    private DiagramEdge edge(String from, String to) {
        return DiagramEdge.builder().id(from + "_to_" + to).from(from).to(to).build();
    }
}
