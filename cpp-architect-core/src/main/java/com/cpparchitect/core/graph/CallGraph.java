package com.cpparchitect.core.graph;

import java.util.List;

import com.cpparchitect.core.model.CallEdge;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.UnresolvedReference;

/**
 * Functions and resolved calls between them.
 *
 * @param functions nodes in first-visit order
 * @param edges de-duplicated caller to callee edges
 * @param unresolved call sites and entry points that did not resolve
 * @param entryPoint entry function name for reachability graphs, null for the whole program
 */
public record CallGraph(
    List<CppFunction> functions,
    List<CallEdge> edges,
    List<UnresolvedReference> unresolved,
    String entryPoint
) {
    /**
     * Compact constructor with validation.
     */
    public CallGraph {
        functions = functions == null ? List.of() : List.copyOf(functions);
        edges = edges == null ? List.of() : List.copyOf(edges);
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }

    public boolean isReachability() {
        return entryPoint != null;
    }
}
