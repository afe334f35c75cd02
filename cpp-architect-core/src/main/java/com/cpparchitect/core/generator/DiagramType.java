package com.cpparchitect.core.generator;

/**
 * Views that can be generated from an entity register.
 */
public enum DiagramType {
    /** Functions and resolved calls; whole program or reachable from an entry point */
    CALL_GRAPH,

    /** Classes with their methods and resolved inheritance */
    CLASS_DIAGRAM,

    /** Directories owning source files */
    MODULE_STRUCTURE,

    /** Control flow of a single function */
    FUNCTION_FLOW
}
