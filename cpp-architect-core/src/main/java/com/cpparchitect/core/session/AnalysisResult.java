package com.cpparchitect.core.session;

import java.util.List;
import java.util.Objects;

import com.cpparchitect.core.generator.GeneratedDiagram;
import com.cpparchitect.core.index.CodeChunk;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.RegisterStatistics;

/**
 * Outcome of one analysis run.
 *
 * @param register extracted entities
 * @param statistics aggregate counts
 * @param chunks indexing chunks, functions first
 * @param diagrams generated diagrams with unique names, views first, then function flows
 * @param filesWritten number of files written, the JSON export included
 */
public record AnalysisResult(
    EntityRegister register,
    RegisterStatistics statistics,
    List<CodeChunk> chunks,
    List<GeneratedDiagram> diagrams,
    int filesWritten
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(register, "register must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
    }

    public long fallbackCount() {
        return diagrams.stream().filter(GeneratedDiagram::isFallback).count();
    }
}
