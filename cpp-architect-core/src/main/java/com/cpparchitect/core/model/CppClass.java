package com.cpparchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A class or struct definition extracted from C++ source.
 *
 * @param name unqualified name
 * @param qualifiedName name prefixed with enclosing namespaces and classes
 * @param kind class or struct
 * @param baseClasses base class names as written in the base clause
 * @param methods member functions defined inline in the class body
 * @param fileId owning file
 * @param lines line range of the definition
 */
public record CppClass(
    String name,
    String qualifiedName,
    ClassKind kind,
    List<String> baseClasses,
    List<CppFunction> methods,
    String fileId,
    LineRange lines
) {
    /**
     * Compact constructor with validation.
     */
    public CppClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(lines, "lines must not be null");
        if (kind == null) {
            kind = ClassKind.CLASS;
        }
        baseClasses = baseClasses == null ? List.of() : List.copyOf(baseClasses);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public EntityId id() {
        return new EntityId(qualifiedName, fileId, lines.startLine());
    }
}
