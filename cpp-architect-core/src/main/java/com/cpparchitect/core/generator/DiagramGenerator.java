package com.cpparchitect.core.generator;

import java.util.Set;

import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;

/**
 * Renders views of an entity register into a textual diagram dialect.
 *
 * <p>Implementations guarantee well-formed output: every source-derived text is
 * sanitized, the rendered text is validated, and a minimal fallback diagram replaces
 * output that fails validation. Output is deterministic for identical input.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DiagramGenerator generator = new DialectDiagramGenerator(Dialect.PLANTUML);
 * GeneratedDiagram diagram = generator.generate(register, DiagramType.CALL_GRAPH,
 *     GeneratorConfig.defaults().withEntryPoint("main"));
 * }</pre>
 *
 * @see DiagramType
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator, e.g. "plantuml".
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns set of diagram types this generator can produce.
     *
     * @return supported diagram types
     */
    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates a diagram from the entity register.
     *
     * <p>{@link DiagramType#FUNCTION_FLOW} renders the function named by
     * {@link GeneratorConfig#entryPoint()}; {@link DiagramType#CALL_GRAPH} uses the entry
     * point for a reachability graph when one is set.
     *
     * @param register the entity register to visualize
     * @param type the diagram type to generate
     * @param config configuration settings for generation
     * @return generated diagram content
     * @throws IllegalArgumentException if the type is unsupported, or a function flow is
     *                                  requested without a function name
     */
    GeneratedDiagram generate(EntityRegister register, DiagramType type, GeneratorConfig config);

    /**
     * Generates the control-flow diagram of one function.
     *
     * @param function the function
     * @param config configuration settings for generation
     * @return generated diagram content
     */
    GeneratedDiagram generateFunctionFlow(CppFunction function, GeneratorConfig config);
}
