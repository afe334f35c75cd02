package com.cpparchitect.core.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cpparchitect.core.config.AnalyzerConfig;
import com.cpparchitect.core.config.AnalyzerConfig.DiagramConfig;
import com.cpparchitect.core.config.AnalyzerConfig.ParsingConfig;
import com.cpparchitect.core.generator.DiagramGenerator;
import com.cpparchitect.core.generator.DiagramType;
import com.cpparchitect.core.generator.Dialect;
import com.cpparchitect.core.generator.GeneratedDiagram;
import com.cpparchitect.core.generator.GeneratorConfig;
import com.cpparchitect.core.generator.impl.DialectDiagramGenerator;
import com.cpparchitect.core.index.RegisterExporter;
import com.cpparchitect.core.model.CppFunction;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.SourceUnit;
import com.cpparchitect.core.renderer.impl.FileSystemRenderer;
import com.cpparchitect.core.scanner.SourceScanner;

import static com.cpparchitect.core.CppFixtures.register;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AnalysisSession}.
 */
class AnalysisSessionTest {

    @TempDir
    Path tempDir;

    private static void copyFixture(Path target) throws Exception {
        Path fixture = Path.of(AnalysisSessionTest.class.getResource("/fixtures/geometry").toURI());
        try (Stream<Path> paths = Files.walk(fixture)) {
            for (Path source : paths.toList()) {
                Path destination = target.resolve(fixture.relativize(source).toString());
                if (Files.isDirectory(source)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(source, destination);
                }
            }
        }
    }

    private AnalyzerConfig configWritingTo(Path outputDir, String dialect) {
        return new AnalyzerConfig(ParsingConfig.defaults(),
            new DiagramConfig(dialect, outputDir.toString(), 3, "main", null, null, null));
    }

    @Test
    void run_fixtureProject_writesViewsFlowsAndExport() throws Exception {
        // Given
        Path project = tempDir.resolve("project");
        Path output = tempDir.resolve("diagrams");
        copyFixture(project);
        AnalysisSession session = new AnalysisSession(configWritingTo(output, "plantuml"));

        // When
        AnalysisResult result = session.run(project.resolve("src"));

        // Then
        List<String> names = result.diagrams().stream().map(GeneratedDiagram::name).toList();
        assertThat(names).doesNotHaveDuplicates();
        assertThat(names).startsWith("call_graph_main", "class_diagram", "module_structure");
        assertThat(names).contains("flow_main", "flow_geo_clamp", "flow_geo_Circle_area");
        assertThat(result.fallbackCount()).isZero();
        assertThat(result.filesWritten()).isEqualTo(result.diagrams().size() + 1);
        assertThat(output.resolve("call_graph_main.puml")).exists();
        assertThat(output.resolve("flow_describe.puml")).exists();
        assertThat(output.resolve(RegisterExporter.DEFAULT_FILE_NAME)).exists();
        assertThat(result.chunks()).hasSize(result.register().functions().size() + result.register().classes().size());
        assertThat(result.statistics().totalClasses()).isEqualTo(3);
    }

    @Test
    void run_mermaidDialect_usesMarkdownExtension() throws Exception {
        Path project = tempDir.resolve("project");
        Path output = tempDir.resolve("out");
        copyFixture(project);

        new AnalysisSession(configWritingTo(output, "mermaid")).run(project.resolve("src"));

        assertThat(output.resolve("class_diagram.md")).exists();
        assertThat(Files.readString(output.resolve("module_structure.md"))).contains("```mermaid");
    }

    @Test
    void forProject_readsConfigurationFile() throws Exception {
        Path project = tempDir.resolve("project");
        copyFixture(project);

        AnalysisSession session = AnalysisSession.forProject(project);

        assertThat(session.getConfig().parsing().fileExtensions()).containsExactly(".cpp", ".hpp");
        assertThat(session.getConfig().diagrams().maxGraphDepth()).isEqualTo(3);
        assertThat(session.getConfig().diagrams().entryPoint()).isEqualTo("main");
    }

    @Test
    void generateAll_overloadsGetLineSuffix() {
        // Given
        EntityRegister register = register(new SourceUnit("o.cpp",
            "int f(int a) { return a; }\nint f(double d) { return 0; }\n"));
        AnalysisSession session = new AnalysisSession(AnalyzerConfig.defaults());

        // When
        List<String> names = session.generateAll(register).stream().map(GeneratedDiagram::name).toList();

        // Then
        assertThat(names).containsExactly("call_graph", "class_diagram", "module_structure", "flow_f", "flow_f_L2");
    }

    @Test
    void generateAll_failingFunctionFlow_skippedAndOthersKept() {
        // Given
        EntityRegister register = register(new SourceUnit("m.cpp",
            "int ok() { return 1; }\nint broken() { return 2; }\nint also() { return 3; }\n"));
        AnalyzerConfig config = AnalyzerConfig.defaults();
        AnalysisSession session = new AnalysisSession(config, new SourceScanner(config.parsing()),
            new FailingFlowGenerator("broken"), new FileSystemRenderer());

        // When
        List<String> names = session.generateAll(register).stream().map(GeneratedDiagram::name).toList();

        // Then
        assertThat(names).contains("flow_ok", "flow_also").doesNotContain("flow_broken");
        assertThat(names).startsWith("call_graph", "class_diagram", "module_structure");
    }

    @Test
    void run_missingSourceRoot_throws() {
        AnalysisSession session = new AnalysisSession(configWritingTo(tempDir.resolve("out"), "dot"));

        assertThatThrownBy(() -> session.run(tempDir.resolve("does-not-exist")))
            .isInstanceOf(IOException.class);
    }

    /**
     * Delegates to the PlantUML generator but fails on the flow of one function.
     */
    private static final class FailingFlowGenerator implements DiagramGenerator {

        private final DiagramGenerator delegate = new DialectDiagramGenerator(Dialect.PLANTUML);
        private final String failingName;

        FailingFlowGenerator(String failingName) {
            this.failingName = failingName;
        }

        @Override
        public String getId() {
            return "failing";
        }

        @Override
        public String getDisplayName() {
            return "Failing";
        }

        @Override
        public String getFileExtension() {
            return delegate.getFileExtension();
        }

        @Override
        public Set<DiagramType> getSupportedDiagramTypes() {
            return delegate.getSupportedDiagramTypes();
        }

        @Override
        public GeneratedDiagram generate(EntityRegister register, DiagramType type, GeneratorConfig config) {
            return delegate.generate(register, type, config);
        }

        @Override
        public GeneratedDiagram generateFunctionFlow(CppFunction function, GeneratorConfig config) {
            if (function.name().equals(failingName)) {
                throw new IllegalStateException("cannot render " + function.name());
            }
            return delegate.generateFunctionFlow(function, config);
        }
    }
}
