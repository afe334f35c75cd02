package com.cpparchitect.core.graph;

import java.util.List;
import java.util.Objects;

/**
 * A diagram node.
 *
 * <p>Label lines are raw source-derived text. Renderers sanitize every line before
 * embedding it and allocate dialect-safe ids for the keys.
 *
 * @param key unique key within the graph
 * @param labelLines label text, one entry per rendered line
 * @param kind node kind
 */
public record GraphNode(
    String key,
    List<String> labelLines,
    NodeKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        labelLines = labelLines == null ? List.of() : List.copyOf(labelLines);
    }

    public static GraphNode of(String key, NodeKind kind, String... labelLines) {
        return new GraphNode(key, List.of(labelLines), kind);
    }
}
