package com.cpparchitect.core.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of an analysis run.
 *
 * <p>Loaded from {@code cpparchitect.yaml}. Every section and value is optional; missing
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parsing:
 *   fileExtensions: [".cpp", ".hpp", ".h"]
 *   ignoredDirectories: ["build", "third_party"]
 *   maxFileSizeMb: 10
 *   maxRecursionDepth: 10
 *   parallelism: 4
 *
 * diagrams:
 *   dialect: plantuml
 *   outputDirectory: "./diagrams"
 *   maxGraphDepth: 5
 *   entryPoint: main
 *   maxSideBySide: 3
 *   labelWidth: 50
 * }</pre>
 *
 * @param parsing source discovery and extraction settings
 * @param diagrams diagram generation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("parsing") ParsingConfig parsing,
    @JsonProperty("diagrams") DiagramConfig diagrams
) {
    /**
     * Compact constructor applying section defaults.
     */
    public AnalyzerConfig {
        if (parsing == null) {
            parsing = ParsingConfig.defaults();
        }
        if (diagrams == null) {
            diagrams = DiagramConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(ParsingConfig.defaults(), DiagramConfig.defaults());
    }

    /**
     * Source discovery and extraction settings.
     *
     * @param fileExtensions file extensions to analyze, with leading dot
     * @param ignoredDirectories directory names skipped anywhere in the tree
     * @param maxFileSizeMb files larger than this are skipped
     * @param maxRecursionDepth nesting cap of the control-flow builder
     * @param parallelism worker threads for per-file extraction
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParsingConfig(
        @JsonProperty("fileExtensions") List<String> fileExtensions,
        @JsonProperty("ignoredDirectories") List<String> ignoredDirectories,
        @JsonProperty("maxFileSizeMb") Integer maxFileSizeMb,
        @JsonProperty("maxRecursionDepth") Integer maxRecursionDepth,
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public static final List<String> DEFAULT_EXTENSIONS =
            List.of(".cpp", ".cc", ".cxx", ".c++", ".hpp", ".h", ".hh", ".hxx");
        public static final List<String> DEFAULT_IGNORED_DIRECTORIES =
            List.of(".git", "build", "cmake-build-debug", "cmake-build-release", "third_party", "external", "node_modules");

        public ParsingConfig {
            fileExtensions = fileExtensions == null || fileExtensions.isEmpty()
                ? DEFAULT_EXTENSIONS : List.copyOf(fileExtensions);
            ignoredDirectories = ignoredDirectories == null
                ? DEFAULT_IGNORED_DIRECTORIES : List.copyOf(ignoredDirectories);
            if (maxFileSizeMb == null || maxFileSizeMb <= 0) {
                maxFileSizeMb = 10;
            }
            if (maxRecursionDepth == null || maxRecursionDepth < 0) {
                maxRecursionDepth = 10;
            }
            if (parallelism == null || parallelism < 1) {
                parallelism = 1;
            }
        }

        public static ParsingConfig defaults() {
            return new ParsingConfig(null, null, null, null, null);
        }

        /**
         * Maximum file size in bytes.
         *
         * @return size limit
         */
        public long maxFileSizeBytes() {
            return maxFileSizeMb * 1024L * 1024L;
        }
    }

    /**
     * Diagram generation settings.
     *
     * @param dialect output dialect id ({@code plantuml}, {@code dot}, {@code mermaid})
     * @param outputDirectory directory diagram files are written to
     * @param maxGraphDepth depth cap of reachability call graphs
     * @param entryPoint entry function for reachability call graphs, null for the whole program
     * @param maxSideBySide functions shown side by side in activity-flow call graphs
     * @param labelWidth label truncation width, null for the dialect default
     * @param conditionWidth condition truncation width, null for the dialect default
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramConfig(
        @JsonProperty("dialect") String dialect,
        @JsonProperty("outputDirectory") String outputDirectory,
        @JsonProperty("maxGraphDepth") Integer maxGraphDepth,
        @JsonProperty("entryPoint") String entryPoint,
        @JsonProperty("maxSideBySide") Integer maxSideBySide,
        @JsonProperty("labelWidth") Integer labelWidth,
        @JsonProperty("conditionWidth") Integer conditionWidth
    ) {
        /** Smallest width override accepted; smaller values fall back to the dialect default */
        public static final int MIN_WIDTH = 10;

        public DiagramConfig {
            if (dialect == null || dialect.isBlank()) {
                dialect = "plantuml";
            }
            if (outputDirectory == null || outputDirectory.isBlank()) {
                outputDirectory = "./diagrams";
            }
            if (maxGraphDepth == null || maxGraphDepth < 0) {
                maxGraphDepth = 5;
            }
            if (entryPoint != null && entryPoint.isBlank()) {
                entryPoint = null;
            }
            if (maxSideBySide == null || maxSideBySide < 1) {
                maxSideBySide = 3;
            }
            if (labelWidth != null && labelWidth < MIN_WIDTH) {
                labelWidth = null;
            }
            if (conditionWidth != null && conditionWidth < MIN_WIDTH) {
                conditionWidth = null;
            }
        }

        public static DiagramConfig defaults() {
            return new DiagramConfig(null, null, null, null, null, null, null);
        }
    }
}
