package com.cpparchitect.core.model;

/**
 * Kind of a C++ class-like definition.
 */
public enum ClassKind {
    /** Declared with {@code class} */
    CLASS,

    /** Declared with {@code struct} */
    STRUCT
}
