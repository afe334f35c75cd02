package com.cpparchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * In-memory collection of everything extracted in one analysis run.
 *
 * <p>Functions include class methods; each method appears both here and in its class's
 * method list as the same instance. Order is file-path order, then pre-order position.
 *
 * @param sourceUnits scanned files in path order
 * @param functions extracted functions and methods
 * @param classes extracted classes and structs
 * @param statistics scan and extraction statistics
 */
public record EntityRegister(
    List<SourceUnit> sourceUnits,
    List<CppFunction> functions,
    List<CppClass> classes,
    ExtractionStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public EntityRegister {
        sourceUnits = sourceUnits == null ? List.of() : List.copyOf(sourceUnits);
        functions = functions == null ? List.of() : List.copyOf(functions);
        classes = classes == null ? List.of() : List.copyOf(classes);
        if (statistics == null) {
            statistics = ExtractionStatistics.empty();
        }
    }

    /**
     * Creates an empty register.
     *
     * @return register without entities
     */
    public static EntityRegister empty() {
        return new EntityRegister(List.of(), List.of(), List.of(), ExtractionStatistics.empty());
    }

    /**
     * Finds functions whose name or qualified name equals the given text.
     *
     * @param name simple or qualified name
     * @return matching functions in register order
     */
    public List<CppFunction> findFunctions(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return functions.stream()
            .filter(f -> f.name().equals(name) || f.qualifiedName().equals(name))
            .toList();
    }
}
