package com.cpparchitect.core.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A self-contained text unit describing one function or class, ready for indexing.
 *
 * @param type chunk type
 * @param name qualified entity name
 * @param content descriptive header followed by the entity's source lines
 * @param metadata flat key/value description of the entity, in insertion order
 */
public record CodeChunk(
    ChunkType type,
    String name,
    String content,
    Map<String, Object> metadata
) {
    /**
     * Kinds of indexed entities.
     */
    public enum ChunkType {
        FUNCTION,
        CLASS
    }

    /**
     * Compact constructor with validation.
     */
    public CodeChunk {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
