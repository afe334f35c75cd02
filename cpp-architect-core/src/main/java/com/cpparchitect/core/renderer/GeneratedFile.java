package com.cpparchitect.core.renderer;

import java.util.Objects;

import com.cpparchitect.core.generator.GeneratedDiagram;

/**
 * A file to be written below the output directory.
 *
 * @param relativePath path relative to the output directory, e.g. "call_graph.puml"
 * @param content file content
 * @param fallback whether the content is a fallback diagram that replaced invalid output
 */
public record GeneratedFile(
    String relativePath,
    String content,
    boolean fallback
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    public static GeneratedFile of(GeneratedDiagram diagram) {
        return new GeneratedFile(diagram.fileName(), diagram.content(), diagram.isFallback());
    }
}
