package com.cpparchitect.core.graph;

import java.util.Objects;

/**
 * A directed diagram edge.
 *
 * @param sourceKey key of the source node
 * @param targetKey key of the target node
 * @param label edge label, or null for none
 */
public record GraphEdge(
    String sourceKey,
    String targetKey,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(sourceKey, "sourceKey must not be null");
        Objects.requireNonNull(targetKey, "targetKey must not be null");
    }
}
