package com.cpparchitect.core.generator;

import com.cpparchitect.core.config.AnalyzerConfig.DiagramConfig;

/**
 * Configuration for diagram generation.
 *
 * @param entryPoint entry function of reachability call graphs, or the function of a
 *                   flow diagram; null for whole-program views
 * @param maxDepth maximum call depth of reachability call graphs
 * @param maxSideBySide functions shown side by side in activity-flow call graphs
 */
public record GeneratorConfig(
    String entryPoint,
    int maxDepth,
    int maxSideBySide
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (entryPoint != null && entryPoint.isBlank()) {
            entryPoint = null;
        }
        if (maxDepth < 0) {
            maxDepth = 5;
        }
        if (maxSideBySide < 1) {
            maxSideBySide = 3;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, 5, 3);
    }

    /**
     * Creates a configuration from the diagram section of the analyzer configuration.
     *
     * @param diagrams diagram settings
     * @return generator config
     */
    public static GeneratorConfig from(DiagramConfig diagrams) {
        return new GeneratorConfig(diagrams.entryPoint(), diagrams.maxGraphDepth(), diagrams.maxSideBySide());
    }

    /**
     * Returns a copy targeting another entry point or function.
     *
     * @param name function name, or null
     * @return new config
     */
    public GeneratorConfig withEntryPoint(String name) {
        return new GeneratorConfig(name, maxDepth, maxSideBySide);
    }
}
