package com.cpparchitect.core.graph;

import java.util.List;

import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.InheritanceEdge;
import com.cpparchitect.core.model.UnresolvedReference;

/**
 * Classes and resolved base to derived relationships.
 *
 * @param classes all register classes
 * @param edges de-duplicated base to derived edges
 * @param unresolved base names without a unique register class
 */
public record InheritanceGraph(
    List<CppClass> classes,
    List<InheritanceEdge> edges,
    List<UnresolvedReference> unresolved
) {
    /**
     * Compact constructor with validation.
     */
    public InheritanceGraph {
        classes = classes == null ? List.of() : List.copyOf(classes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }
}
