package com.cpparchitect.core.model;

import java.util.Objects;

/**
 * Resolved caller to callee relationship.
 *
 * @param sourceId calling function
 * @param targetId called function
 */
public record CallEdge(
    EntityId sourceId,
    EntityId targetId
) {
    /**
     * Compact constructor with validation.
     */
    public CallEdge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }
}
