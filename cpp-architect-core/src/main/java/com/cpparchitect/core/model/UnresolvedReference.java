package com.cpparchitect.core.model;

import java.util.Objects;

/**
 * A reference that did not resolve to exactly one register entity.
 *
 * <p>No edge is produced for it. Its presence tells consumers that a missing edge does
 * not prove a missing relationship.
 *
 * @param sourceId referencing entity, or null for entry points
 * @param targetName name as written in source or configuration
 * @param kind reference kind
 * @param reason why resolution failed
 */
public record UnresolvedReference(
    EntityId sourceId,
    String targetName,
    ReferenceKind kind,
    Reason reason
) {
    /**
     * Why a reference stayed unresolved.
     */
    public enum Reason {
        /** No register entity carries the name (external, library or macro) */
        UNKNOWN,

        /** Several register entities carry the name (overloads, same-named nested entities) */
        AMBIGUOUS
    }

    /**
     * Compact constructor with validation.
     */
    public UnresolvedReference {
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
