package com.cpparchitect.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A renderable diagram: ordered nodes and edges.
 *
 * <p>Graphs are derived views, recomputed from the entity register on demand. Every
 * edge references nodes of the same graph and duplicate edges are collapsed.
 *
 * @param title diagram title
 * @param direction layout direction
 * @param nodes nodes in rendering order
 * @param edges edges in rendering order
 */
public record Graph(
    String title,
    Direction direction,
    List<GraphNode> nodes,
    List<GraphEdge> edges
) {
    /**
     * Layout direction hint.
     */
    public enum Direction {
        /** Left to right */
        LEFT_RIGHT,

        /** Top to bottom */
        TOP_BOTTOM
    }

    /**
     * Compact constructor with validation.
     */
    public Graph {
        Objects.requireNonNull(title, "title must not be null");
        if (direction == null) {
            direction = Direction.TOP_BOTTOM;
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Incremental builder that keeps first-insertion order and drops duplicates.
     */
    public static final class Builder {
        private final String title;
        private final Direction direction;
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<GraphEdge> edges = new LinkedHashSet<>();

        public Builder(String title, Direction direction) {
            this.title = title;
            this.direction = direction;
        }

        /**
         * Adds a node unless one with the same key exists.
         *
         * @param node node to add
         * @return this builder
         */
        public Builder node(GraphNode node) {
            nodes.putIfAbsent(node.key(), node);
            return this;
        }

        /**
         * Adds an edge between two known nodes.
         *
         * @param edge edge to add
         * @return this builder
         * @throws IllegalArgumentException if an endpoint is not a node of this graph
         */
        public Builder edge(GraphEdge edge) {
            if (!nodes.containsKey(edge.sourceKey()) || !nodes.containsKey(edge.targetKey())) {
                throw new IllegalArgumentException("Edge references unknown node: " + edge);
            }
            edges.add(edge);
            return this;
        }

        public Graph build() {
            return new Graph(title, direction, new ArrayList<>(nodes.values()), new ArrayList<>(edges));
        }
    }
}
