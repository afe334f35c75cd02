package com.cpparchitect.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one analysis run, in writing order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public long fallbackCount() {
        return files.stream().filter(GeneratedFile::fallback).count();
    }
}
