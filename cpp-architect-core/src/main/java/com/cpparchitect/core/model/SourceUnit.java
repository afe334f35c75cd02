package com.cpparchitect.core.model;

import java.util.Objects;

/**
 * A source file read for one analysis run.
 *
 * @param fileId file identifier, a path relative to the scanned root using forward slashes
 * @param text raw source text
 */
public record SourceUnit(
    String fileId,
    String text
) {
    /**
     * Compact constructor with validation.
     */
    public SourceUnit {
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns the parent directory part of the file id.
     *
     * @return directory path, or "." for files at the root
     */
    public String directory() {
        int slash = fileId.lastIndexOf('/');
        return slash < 0 ? "." : fileId.substring(0, slash);
    }

    /**
     * Returns the file name part of the file id.
     *
     * @return file name
     */
    public String fileName() {
        return fileId.substring(fileId.lastIndexOf('/') + 1);
    }
}
