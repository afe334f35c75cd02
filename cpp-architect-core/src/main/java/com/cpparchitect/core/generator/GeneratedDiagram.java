package com.cpparchitect.core.generator;

import java.util.List;
import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name file-safe diagram name
 * @param content diagram text
 * @param fileExtension file extension for this content
 * @param validationErrors problems found in the rendered text; when non-empty the content
 *                         is the minimal fallback diagram
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension,
    List<String> validationErrors
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public boolean isFallback() {
        return !validationErrors.isEmpty();
    }

    public String fileName() {
        return name + "." + fileExtension;
    }
}
