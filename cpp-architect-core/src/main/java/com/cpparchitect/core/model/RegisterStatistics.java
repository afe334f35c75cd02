package com.cpparchitect.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregate counts over an entity register, for reporting layers.
 *
 * @param totalFunctions functions including methods
 * @param totalClasses classes and structs
 * @param totalMethods methods defined inline in class bodies
 * @param avgMethodsPerClass average inline methods per class, 0 without classes
 * @param functionsByFile function count per file, files in path order
 * @param classesByFile class count per file, files in path order
 * @param extraction scan and extraction statistics
 */
public record RegisterStatistics(
    int totalFunctions,
    int totalClasses,
    int totalMethods,
    double avgMethodsPerClass,
    Map<String, Integer> functionsByFile,
    Map<String, Integer> classesByFile,
    ExtractionStatistics extraction
) {
    /**
     * Compact constructor with validation.
     */
    public RegisterStatistics {
        functionsByFile = functionsByFile == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(functionsByFile));
        classesByFile = classesByFile == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(classesByFile));
        if (extraction == null) {
            extraction = ExtractionStatistics.empty();
        }
    }

    /**
     * Computes statistics for a register.
     *
     * @param register the register
     * @return aggregate statistics
     */
    public static RegisterStatistics of(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");

        Map<String, Integer> functionsByFile = new TreeMap<>();
        for (CppFunction function : register.functions()) {
            functionsByFile.merge(function.fileId(), 1, Integer::sum);
        }
        Map<String, Integer> classesByFile = new TreeMap<>();
        int totalMethods = 0;
        for (CppClass cppClass : register.classes()) {
            classesByFile.merge(cppClass.fileId(), 1, Integer::sum);
            totalMethods += cppClass.methods().size();
        }

        int totalClasses = register.classes().size();
        double average = totalClasses == 0 ? 0.0 : (double) totalMethods / totalClasses;

        return new RegisterStatistics(
            register.functions().size(),
            totalClasses,
            totalMethods,
            average,
            functionsByFile,
            classesByFile,
            register.statistics()
        );
    }
}
