package com.cpparchitect.core.model;

import java.util.Objects;

/**
 * Resolved base to derived class relationship.
 *
 * @param sourceId base class
 * @param targetId derived class
 */
public record InheritanceEdge(
    EntityId sourceId,
    EntityId targetId
) {
    /**
     * Compact constructor with validation.
     */
    public InheritanceEdge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }
}
