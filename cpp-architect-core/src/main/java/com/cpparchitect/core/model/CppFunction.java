package com.cpparchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A function or method definition extracted from C++ source.
 *
 * @param name unqualified name
 * @param qualifiedName name prefixed with enclosing namespaces and class, joined with {@code ::}
 * @param returnType return type text, {@code void} when the definition has none
 * @param parameters parameter declarations, verbatim
 * @param fileId owning file
 * @param lines line range of the definition
 * @param owningClass unqualified owning class name, or null for free functions
 * @param calls callee names, one per call site, in source order
 * @param controlFlow control-flow forest of the body
 */
public record CppFunction(
    String name,
    String qualifiedName,
    String returnType,
    List<String> parameters,
    String fileId,
    LineRange lines,
    String owningClass,
    List<String> calls,
    List<ControlFlowNode> controlFlow
) {
    /**
     * Compact constructor with validation.
     */
    public CppFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(lines, "lines must not be null");
        if (returnType == null || returnType.isBlank()) {
            returnType = "void";
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        calls = calls == null ? List.of() : List.copyOf(calls);
        controlFlow = controlFlow == null ? List.of() : List.copyOf(controlFlow);
    }

    public EntityId id() {
        return new EntityId(qualifiedName, fileId, lines.startLine());
    }

    public boolean isMethod() {
        return owningClass != null;
    }

    /**
     * Returns the signature shown in listings, e.g. {@code area(double r) -> double}.
     *
     * @return display signature
     */
    public String signature() {
        return name + "(" + String.join(", ", parameters) + ") -> " + returnType;
    }
}
