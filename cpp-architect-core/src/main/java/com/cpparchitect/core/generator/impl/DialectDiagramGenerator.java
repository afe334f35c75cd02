package com.cpparchitect.core.generator.impl;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.config.AnalyzerConfig.DiagramConfig;
import com.cpparchitect.core.generator.DiagramGenerator;
import com.cpparchitect.core.generator.DiagramType;
import com.cpparchitect.core.generator.DiagramValidator;
import com.cpparchitect.core.generator.Dialect;
import com.cpparchitect.core.generator.GeneratedDiagram;
import com.cpparchitect.core.generator.GeneratorConfig;
import com.cpparchitect.core.generator.TextSanitizer;
import com.cpparchitect.core.graph.CallGraph;
import com.cpparchitect.core.graph.FlowchartAssembler;
import com.cpparchitect.core.graph.GraphAssembler;
import com.cpparchitect.core.graph.InheritanceGraph;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;

/**
 * Generates diagrams in one {@link Dialect}.
 *
 * <p>One implementation serves every dialect: graph-description dialects render the
 * graphs built by {@link GraphAssembler} and {@link FlowchartAssembler} as node and edge
 * lists, activity-flow dialects render the control-flow forest directly as structured
 * activities.
 *
 * <h2>Supported Diagram Types</h2>
 * <ul>
 *   <li><b>Call Graph:</b> whole program, or reachable from the configured entry point</li>
 *   <li><b>Class Diagram:</b> classes with their methods and resolved base classes</li>
 *   <li><b>Module Structure:</b> source files grouped by directory</li>
 *   <li><b>Function Flow:</b> control flow of a single function</li>
 * </ul>
 *
 * <p>Every rendered document is checked by a {@link DiagramValidator}. A document that
 * fails is replaced by a minimal single-node diagram; the returned
 * {@link GeneratedDiagram} then carries the validation errors.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DiagramGenerator generator = new DialectDiagramGenerator(Dialect.DOT);
 * GeneratedDiagram diagram = generator.generate(register, DiagramType.CLASS_DIAGRAM,
 *     GeneratorConfig.defaults());
 * }</pre>
 */
public class DialectDiagramGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DialectDiagramGenerator.class);

    // Diagram names
    private static final String CALL_GRAPH_NAME = "call_graph";
    private static final String CLASS_DIAGRAM_NAME = "class_diagram";
    private static final String MODULE_STRUCTURE_NAME = "module_structure";
    private static final String FLOW_PREFIX = "flow_";

    private final Dialect dialect;
    private final TextSanitizer sanitizer;
    private final DiagramValidator validator;
    private final GraphAssembler graphAssembler = new GraphAssembler();
    private final FlowchartAssembler flowchartAssembler = new FlowchartAssembler();
    private final GraphDocumentWriter graphWriter;
    private final ActivityDocumentWriter activityWriter;

    public DialectDiagramGenerator(Dialect dialect) {
        this(dialect, new DiagramValidator(dialect));
    }

    DialectDiagramGenerator(Dialect dialect, DiagramValidator validator) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.sanitizer = new TextSanitizer(dialect);
        this.graphWriter = dialect.family() == Dialect.Family.GRAPH_DESCRIPTION
            ? new GraphDocumentWriter(dialect, sanitizer)
            : null;
        this.activityWriter = dialect.family() == Dialect.Family.ACTIVITY_FLOW
            ? new ActivityDocumentWriter(sanitizer)
            : null;
    }

    /**
     * Creates a generator for the configured dialect and width overrides.
     *
     * @param diagrams diagram settings
     * @return generator
     * @throws IllegalArgumentException if the dialect is unknown
     */
    public static DialectDiagramGenerator forConfig(DiagramConfig diagrams) {
        Objects.requireNonNull(diagrams, "diagrams must not be null");
        Dialect dialect = Dialect.fromId(diagrams.dialect()).withWidths(diagrams.labelWidth(), diagrams.conditionWidth());
        return new DialectDiagramGenerator(dialect);
    }

    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public String getId() {
        return dialect.id();
    }

    @Override
    public String getDisplayName() {
        return dialect.displayName();
    }

    @Override
    public String getFileExtension() {
        return dialect.fileExtension();
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(
            DiagramType.CALL_GRAPH,
            DiagramType.CLASS_DIAGRAM,
            DiagramType.MODULE_STRUCTURE,
            DiagramType.FUNCTION_FLOW
        );
    }

    @Override
    public GeneratedDiagram generate(EntityRegister register, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(register, "register must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating {} diagram for type: {}", dialect.id(), type);

        return switch (type) {
            case CALL_GRAPH -> generateCallGraph(register, config);
            case CLASS_DIAGRAM -> generateClassDiagram(register);
            case MODULE_STRUCTURE -> generateModuleStructure(register);
            case FUNCTION_FLOW -> generateFlowByName(register, config);
        };
    }

    @Override
    public GeneratedDiagram generateFunctionFlow(CppFunction function, GeneratorConfig config) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String title = "Function Flow - " + function.qualifiedName();
        String content = activityWriter != null
            ? activityWriter.functionFlow(function)
            : graphWriter.write(flowchartAssembler.assemble(function));
        return finish(diagramName(FLOW_PREFIX + function.qualifiedName()), title, content);
    }

    private GeneratedDiagram generateCallGraph(EntityRegister register, GeneratorConfig config) {
        CallGraph callGraph = config.entryPoint() != null
            ? graphAssembler.reachableFrom(register, config.entryPoint(), config.maxDepth())
            : graphAssembler.callGraph(register);

        String name = callGraph.isReachability()
            ? diagramName(CALL_GRAPH_NAME + "_" + callGraph.entryPoint())
            : CALL_GRAPH_NAME;
        String title = callGraph.isReachability() ? "Call Graph from " + callGraph.entryPoint() : "Call Graph";
        String content = activityWriter != null
            ? activityWriter.callGraph(callGraph, config.maxSideBySide())
            : graphWriter.write(graphAssembler.toGraph(callGraph));
        return finish(name, title, content);
    }

    private GeneratedDiagram generateClassDiagram(EntityRegister register) {
        InheritanceGraph inheritance = graphAssembler.inheritanceGraph(register);
        String content = activityWriter != null
            ? activityWriter.classDiagram(inheritance)
            : graphWriter.write(graphAssembler.toGraph(inheritance));
        return finish(CLASS_DIAGRAM_NAME, "Class Hierarchy", content);
    }

    private GeneratedDiagram generateModuleStructure(EntityRegister register) {
        String content = activityWriter != null
            ? activityWriter.moduleStructure(graphAssembler.groupByDirectory(register))
            : graphWriter.write(graphAssembler.containmentGraph(register));
        return finish(MODULE_STRUCTURE_NAME, "Module Structure", content);
    }

    private GeneratedDiagram generateFlowByName(EntityRegister register, GeneratorConfig config) {
        String functionName = config.entryPoint();
        if (functionName == null) {
            throw new IllegalArgumentException("Function flow requires a function name as entry point");
        }
        List<CppFunction> matches = register.findFunctions(functionName);
        if (matches.isEmpty()) {
            log.warn("Function '{}' not found, emitting fallback flow diagram", functionName);
            String title = "Function Flow - " + functionName;
            return new GeneratedDiagram(diagramName(FLOW_PREFIX + functionName), fallback(title),
                getFileExtension(), List.of("Function not found: " + functionName));
        }
        return generateFunctionFlow(matches.get(0), config);
    }

    private GeneratedDiagram finish(String name, String title, String content) {
        List<String> errors = validator.validate(content);
        if (!errors.isEmpty()) {
            log.warn("Diagram '{}' failed validation, emitting fallback: {}", name, errors);
            return new GeneratedDiagram(name, fallback(title), getFileExtension(), errors);
        }
        log.info("Generated {} diagram: {}", dialect.displayName(), name);
        return new GeneratedDiagram(name, content, getFileExtension(), List.of());
    }

    /**
     * Minimal single-node diagram in this dialect.
     *
     * @param title diagram title, also used as the node label
     * @return well-formed fallback document
     */
    String fallback(String title) {
        return activityWriter != null
            ? activityWriter.singleActivity(title, title)
            : graphWriter.writeSingleNode(title, title);
    }

    private String diagramName(String raw) {
        return sanitizer.filename(raw);
    }
}
