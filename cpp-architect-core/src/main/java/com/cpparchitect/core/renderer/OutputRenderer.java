package com.cpparchitect.core.renderer;

/**
 * Writes generated diagram files to a destination.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. "filesystem".
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes every file of the output.
     *
     * @param output files to write
     * @param context destination settings
     * @return number of files written
     * @throws IllegalStateException if the destination cannot be written
     * @throws IllegalArgumentException if a file path escapes the output directory
     */
    int render(GeneratedOutput output, RenderContext context);
}
