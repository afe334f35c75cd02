package com.cpparchitect.core.model;

/**
 * Inclusive 1-based line range of an entity in its file.
 *
 * @param startLine first line
 * @param endLine last line
 */
public record LineRange(
    int startLine,
    int endLine
) {
    /**
     * Compact constructor with validation.
     */
    public LineRange {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, was " + startLine);
        }
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    /**
     * Number of lines covered.
     *
     * @return line count
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }
}
