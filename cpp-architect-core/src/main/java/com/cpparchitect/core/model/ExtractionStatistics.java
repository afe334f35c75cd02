package com.cpparchitect.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics collected while scanning and extracting one source tree.
 *
 * <p>Skips are not user-facing failures, but they are counted here so that diagnostics
 * can tell an empty diagram caused by skipped input from a genuinely empty project.
 *
 * @param filesDiscovered files matching the configured extensions
 * @param filesParsed files parsed and walked
 * @param filesSkipped skipped files per reason (oversized, unreadable, parse-failure)
 * @param entitiesSkipped skipped definitions per reason (missing-name, missing-body, ...)
 * @param topErrors most significant skip messages (max 10)
 */
public record ExtractionStatistics(
    int filesDiscovered,
    int filesParsed,
    Map<String, Integer> filesSkipped,
    Map<String, Integer> entitiesSkipped,
    List<String> topErrors
) {
    /** Upper bound on retained error messages */
    public static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ExtractionStatistics {
        if (filesDiscovered < 0) {
            filesDiscovered = 0;
        }
        if (filesParsed < 0) {
            filesParsed = 0;
        }
        filesSkipped = filesSkipped == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(filesSkipped));
        entitiesSkipped = entitiesSkipped == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(entitiesSkipped));
        if (topErrors == null) {
            topErrors = List.of();
        } else if (topErrors.size() > MAX_TOP_ERRORS) {
            topErrors = List.copyOf(topErrors.subList(0, MAX_TOP_ERRORS));
        } else {
            topErrors = List.copyOf(topErrors);
        }
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ExtractionStatistics empty() {
        return new ExtractionStatistics(0, 0, Map.of(), Map.of(), List.of());
    }

    /**
     * Total number of skipped files across all reasons.
     *
     * @return skipped file count
     */
    public int totalFilesSkipped() {
        return filesSkipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Total number of skipped definitions across all reasons.
     *
     * @return skipped entity count
     */
    public int totalEntitiesSkipped() {
        return entitiesSkipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Calculates the share of discovered files that were parsed.
     *
     * @return parse rate as percentage (0.0 to 100.0), or 0 if nothing was discovered
     */
    public double getParseRate() {
        if (filesDiscovered == 0) {
            return 0.0;
        }
        return (filesParsed * 100.0) / filesDiscovered;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return formatted summary
     */
    public String getSummary() {
        return String.format("Discovered: %d, Parsed: %d (%.1f%%), Files skipped: %d, Entities skipped: %d",
            filesDiscovered, filesParsed, getParseRate(), totalFilesSkipped(), totalEntitiesSkipped());
    }
}
