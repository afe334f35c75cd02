package com.cpparchitect.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how renderers write.
 *
 * @param outputDirectory target directory, created when missing
 * @param overwrite whether existing files are replaced; when false they are kept and skipped
 */
public record RenderContext(
    Path outputDirectory,
    boolean overwrite
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    public static RenderContext of(String outputDirectory) {
        return new RenderContext(Path.of(outputDirectory), true);
    }
}
