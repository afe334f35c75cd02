package com.cpparchitect.core.session;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.config.AnalyzerConfig;
import com.cpparchitect.core.config.ConfigLoader;
import com.cpparchitect.core.generator.DiagramGenerator;
import com.cpparchitect.core.generator.DiagramType;
import com.cpparchitect.core.generator.GeneratedDiagram;
import com.cpparchitect.core.generator.GeneratorConfig;
import com.cpparchitect.core.generator.impl.DialectDiagramGenerator;
import com.cpparchitect.core.index.CodeChunk;
import com.cpparchitect.core.index.EntityChunker;
import com.cpparchitect.core.index.RegisterExporter;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.RegisterStatistics;
import com.cpparchitect.core.renderer.GeneratedFile;
import com.cpparchitect.core.renderer.GeneratedOutput;
import com.cpparchitect.core.renderer.OutputRenderer;
import com.cpparchitect.core.renderer.RenderContext;
import com.cpparchitect.core.renderer.impl.FileSystemRenderer;
import com.cpparchitect.core.scanner.SourceScanner;

/**
 * Runs the whole pipeline for one source tree.
 *
 * <ol>
 *   <li>Scan and extract the source tree into an entity register</li>
 *   <li>Generate the call graph, class diagram and module structure views</li>
 *   <li>Generate one flow diagram per function</li>
 *   <li>Chunk functions and classes for indexing</li>
 *   <li>Write every diagram and the JSON export of the register below the output directory</li>
 * </ol>
 *
 * <p>A view or function flow whose generation fails is logged and left out; the rest of
 * the run continues.
 *
 * <p>Flow diagrams of functions sharing a qualified name (overloads, same name in several
 * files) get a {@code _L<line>} suffix so every file name is unique.
 */
public class AnalysisSession {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSession.class);

    /** Views generated for every run, in output order */
    public static final List<DiagramType> VIEWS =
        List.of(DiagramType.CALL_GRAPH, DiagramType.CLASS_DIAGRAM, DiagramType.MODULE_STRUCTURE);

    private final AnalyzerConfig config;
    private final SourceScanner scanner;
    private final DiagramGenerator generator;
    private final OutputRenderer renderer;
    private final EntityChunker chunker = new EntityChunker();
    private final RegisterExporter exporter = new RegisterExporter();

    public AnalysisSession(AnalyzerConfig config) {
        this(config, new SourceScanner(config.parsing()), DialectDiagramGenerator.forConfig(config.diagrams()),
            new FileSystemRenderer());
    }

    public AnalysisSession(AnalyzerConfig config, SourceScanner scanner, DiagramGenerator generator,
                           OutputRenderer renderer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Creates a session configured from {@code cpparchitect.yaml} in the project root,
     * or from defaults when the file is absent.
     *
     * @param projectRoot project root directory
     * @return session
     */
    public static AnalysisSession forProject(Path projectRoot) {
        return new AnalysisSession(ConfigLoader.loadFromDirectory(projectRoot));
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    /**
     * Analyzes a source tree and writes its diagrams.
     *
     * @param sourceRoot root of the source tree
     * @return register, statistics, chunks and generated diagrams
     * @throws IOException if the source tree cannot be walked
     */
    public AnalysisResult run(Path sourceRoot) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot must not be null");
        EntityRegister register = scanner.scan(sourceRoot);
        RegisterStatistics statistics = RegisterStatistics.of(register);
        log.info("Extracted {} functions and {} classes ({} methods)",
            statistics.totalFunctions(), statistics.totalClasses(), statistics.totalMethods());

        List<GeneratedDiagram> diagrams = generateAll(register);
        List<CodeChunk> chunks = chunker.chunk(register);

        List<GeneratedFile> files = new ArrayList<>();
        diagrams.forEach(diagram -> files.add(GeneratedFile.of(diagram)));
        files.add(new GeneratedFile(RegisterExporter.DEFAULT_FILE_NAME, exporter.toJson(register), false));
        int written = renderer.render(new GeneratedOutput(files),
            RenderContext.of(config.diagrams().outputDirectory()));

        AnalysisResult result = new AnalysisResult(register, statistics, chunks, diagrams, written);
        log.info("Analysis complete: {} diagrams, {} fallbacks", diagrams.size(), result.fallbackCount());
        return result;
    }

    /**
     * Generates every view and every function flow of a register.
     *
     * @param register the entity register
     * @return diagrams with unique names
     */
    public List<GeneratedDiagram> generateAll(EntityRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        GeneratorConfig generatorConfig = GeneratorConfig.from(config.diagrams());
        List<GeneratedDiagram> diagrams = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();

        for (DiagramType view : VIEWS) {
            try {
                diagrams.add(generator.generate(register, view, generatorConfig));
                usedNames.add(diagrams.get(diagrams.size() - 1).name());
            } catch (RuntimeException e) {
                log.warn("Failed to generate {} with generator {}: {}", view, generator.getId(), e.getMessage());
            }
        }

        for (CppFunction function : register.functions()) {
            GeneratedDiagram flow;
            try {
                flow = generator.generateFunctionFlow(function, generatorConfig);
            } catch (RuntimeException e) {
                log.warn("Failed to generate flow of {} in {}: {}", function.qualifiedName(), function.fileId(),
                    e.getMessage());
                continue;
            }
            if (!usedNames.add(flow.name())) {
                String base = flow.name() + "_L" + function.lines().startLine();
                String unique = base;
                for (int n = 2; !usedNames.add(unique); n++) {
                    unique = base + "_" + n;
                }
                flow = new GeneratedDiagram(unique, flow.content(), flow.fileExtension(), flow.validationErrors());
            }
            diagrams.add(flow);
        }
        return diagrams;
    }
}
