package com.cpparchitect.core.graph;

/**
 * Kinds of diagram nodes. Dialects map each kind to a shape and color.
 */
public enum NodeKind {
    /** A function or method in a call graph */
    FUNCTION,

    /** A class or struct in an inheritance graph */
    CLASS,

    /** A directory in a containment graph */
    DIRECTORY,

    /** A source file in a containment graph */
    FILE,

    /** Entry of a function flowchart */
    START,

    /** Exit of a function flowchart */
    END,

    /** A call or plain statement in a flowchart */
    ACTION,

    /** A branch point: condition, loop test or switch selector */
    DECISION,

    /** A return statement in a flowchart */
    RETURN
}
