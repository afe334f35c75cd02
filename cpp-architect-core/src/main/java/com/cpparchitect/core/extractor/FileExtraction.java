package com.cpparchitect.core.extractor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;

/**
 * Entities extracted from a single file, before merging into the register.
 *
 * @param fileId the file
 * @param functions functions and methods in pre-order
 * @param classes classes and structs in pre-order
 * @param skippedEntities skipped definitions per reason
 * @param errors skip messages with file and line
 */
public record FileExtraction(
    String fileId,
    List<CppFunction> functions,
    List<CppClass> classes,
    Map<String, Integer> skippedEntities,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public FileExtraction {
        Objects.requireNonNull(fileId, "fileId must not be null");
        functions = functions == null ? List.of() : List.copyOf(functions);
        classes = classes == null ? List.of() : List.copyOf(classes);
        skippedEntities = skippedEntities == null ? Map.of() : Map.copyOf(skippedEntities);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
