package com.cpparchitect.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.cpparchitect.core.generator.Dialect;
import com.cpparchitect.core.generator.Dialect.GraphSyntax;
import com.cpparchitect.core.generator.TextSanitizer;
import com.cpparchitect.core.graph.Graph;
import com.cpparchitect.core.graph.GraphEdge;
import com.cpparchitect.core.graph.GraphNode;
import com.cpparchitect.core.graph.NodeKind;

/**
 * Writes a {@link Graph} in a graph-description dialect: header, node list, edge list,
 * footer. Node ids come from a fresh {@link NodeIdAllocator} per document.
 */
final class GraphDocumentWriter {

    static final String EMPTY_GRAPH_LABEL = "No entities found";

    private final Dialect dialect;
    private final GraphSyntax syntax;
    private final TextSanitizer sanitizer;

    GraphDocumentWriter(Dialect dialect, TextSanitizer sanitizer) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.syntax = Objects.requireNonNull(dialect.graphSyntax(), "dialect has no graph syntax");
        this.sanitizer = sanitizer;
    }

    String write(Graph graph) {
        NodeIdAllocator ids = new NodeIdAllocator();
        StringBuilder sb = new StringBuilder();
        sb.append(header(graph.title(), graph.direction()));

        if (graph.isEmpty()) {
            appendNode(sb, ids, GraphNode.of("empty", NodeKind.ACTION, EMPTY_GRAPH_LABEL));
        }
        for (GraphNode node : graph.nodes()) {
            appendNode(sb, ids, node);
        }
        for (GraphEdge edge : graph.edges()) {
            String source = ids.idFor(edge.sourceKey());
            String target = ids.idFor(edge.targetKey());
            if (edge.label() == null || edge.label().isBlank()) {
                sb.append(String.format(syntax.edgeTemplate(), source, target));
            } else {
                sb.append(String.format(syntax.labelledEdgeTemplate(), source, target, sanitizer.label(edge.label())));
            }
            sb.append('\n');
        }

        sb.append(syntax.footer());
        return sb.toString();
    }

    /**
     * Writes a single-node document.
     *
     * @param title diagram title
     * @param label text of the only node
     * @return document text
     */
    String writeSingleNode(String title, String label) {
        Graph graph = new Graph.Builder(title, Graph.Direction.TOP_BOTTOM)
            .node(GraphNode.of("fallback", NodeKind.ACTION, label))
            .build();
        return write(graph);
    }

    private String header(String title, Graph.Direction direction) {
        String directionToken = direction == Graph.Direction.LEFT_RIGHT ? syntax.leftRight() : syntax.topBottom();
        return String.format(syntax.header(), sanitizer.label(title), directionToken);
    }

    private void appendNode(StringBuilder sb, NodeIdAllocator ids, GraphNode node) {
        List<String> lines = new ArrayList<>();
        for (String line : node.labelLines()) {
            lines.add(node.kind() == NodeKind.DECISION ? sanitizer.condition(line) : sanitizer.label(line));
        }
        if (lines.isEmpty()) {
            lines.add(sanitizer.label(null));
        }
        String label = String.join(dialect.lineBreak(), lines);
        sb.append(String.format(syntax.nodeTemplates().get(node.kind()), ids.idFor(node.key()), label));
        sb.append('\n');
    }
}
