package com.cpparchitect.core.model;

import java.util.Objects;

/**
 * Identity of an extracted function or class.
 *
 * <p>Qualified names alone are not unique (overloads, same-named nested entities),
 * so identity also carries the file and start line.
 *
 * @param qualifiedName namespace/class prefixed name
 * @param fileId owning file
 * @param line 1-based start line
 */
public record EntityId(
    String qualifiedName,
    String fileId,
    int line
) {
    /**
     * Compact constructor with validation.
     */
    public EntityId {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
    }

    @Override
    public String toString() {
        return qualifiedName + "@" + fileId + ":" + line;
    }
}
