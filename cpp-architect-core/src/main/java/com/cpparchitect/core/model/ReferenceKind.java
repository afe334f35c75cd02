package com.cpparchitect.core.model;

/**
 * Kinds of name references that graph assembly tries to resolve.
 */
public enum ReferenceKind {
    /** Callee name at a call site */
    CALL,

    /** Base class name in a base clause */
    BASE_CLASS,

    /** Entry point requested for a reachability graph */
    ENTRY_POINT
}
