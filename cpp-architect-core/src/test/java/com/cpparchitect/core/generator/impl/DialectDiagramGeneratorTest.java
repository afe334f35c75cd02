package com.cpparchitect.core.generator.impl;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.cpparchitect.core.config.AnalyzerConfig.DiagramConfig;
import com.cpparchitect.core.config.AnalyzerConfig.ParsingConfig;
import com.cpparchitect.core.generator.DiagramType;
import com.cpparchitect.core.generator.DiagramValidator;
import com.cpparchitect.core.generator.Dialect;
import com.cpparchitect.core.generator.GeneratedDiagram;
import com.cpparchitect.core.generator.GeneratorConfig;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.SourceUnit;
import com.cpparchitect.core.scanner.SourceScanner;

import static com.cpparchitect.core.CppFixtures.register;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DialectDiagramGenerator}.
 */
class DialectDiagramGeneratorTest {

    private static final String BRANCHING = "int f(int a){ if (a>0) { return a; } else { return 0; } }";

    private static EntityRegister geometry;

    @BeforeAll
    static void scanFixture() throws Exception {
        geometry = new SourceScanner(ParsingConfig.defaults()).scan(fixtureRoot());
    }

    private static Path fixtureRoot() throws URISyntaxException {
        return Path.of(DialectDiagramGeneratorTest.class.getResource("/fixtures/geometry").toURI());
    }

    private static long linesStartingWith(String content, String prefix) {
        return Arrays.stream(content.split("\n"))
            .map(String::trim)
            .filter(line -> line.startsWith(prefix))
            .count();
    }

    @Test
    void generate_branchingFunction_opensAndClosesOneConditional() {
        // Given
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.PLANTUML);
        EntityRegister register = register(new SourceUnit("f.cpp", BRANCHING));

        // When
        GeneratedDiagram diagram = generator.generate(register, DiagramType.FUNCTION_FLOW,
            GeneratorConfig.defaults().withEntryPoint("f"));

        // Then
        assertThat(diagram.isFallback()).isFalse();
        assertThat(diagram.name()).isEqualTo("flow_f");
        assertThat(diagram.fileName()).isEqualTo("flow_f.puml");
        assertThat(linesStartingWith(diagram.content(), "if (")).isEqualTo(1);
        assertThat(linesStartingWith(diagram.content(), "endif")).isEqualTo(1);
        assertThat(diagram.content()).contains("a>0", ":return a;", ":return 0;");
    }

    @Test
    void generate_sameInput_byteIdenticalOutput() {
        // Given
        DialectDiagramGenerator first = new DialectDiagramGenerator(Dialect.PLANTUML);
        DialectDiagramGenerator second = new DialectDiagramGenerator(Dialect.PLANTUML);
        GeneratorConfig config = GeneratorConfig.defaults().withEntryPoint("main");

        // When / Then
        for (DiagramType type : DiagramType.values()) {
            assertThat(first.generate(geometry, type, config).content())
                .isEqualTo(second.generate(geometry, type, config).content());
        }
    }

    @Test
    void generate_functionWithoutFlow_showsExecuteBodyActivity() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.PLANTUML);
        EntityRegister register = register(new SourceUnit("g.cpp", "void g() {}"));

        GeneratedDiagram diagram = generator.generate(register, DiagramType.FUNCTION_FLOW,
            GeneratorConfig.defaults().withEntryPoint("g"));

        assertThat(diagram.content()).contains(":execute function body;");
        assertThat(diagram.isFallback()).isFalse();
    }

    @Test
    void generate_functionFlowWithoutName_throws() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.DOT);

        assertThatThrownBy(() -> generator.generate(geometry, DiagramType.FUNCTION_FLOW, GeneratorConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generate_unknownFunction_returnsValidFallback() {
        // Given
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.MERMAID);

        // When
        GeneratedDiagram diagram = generator.generate(geometry, DiagramType.FUNCTION_FLOW,
            GeneratorConfig.defaults().withEntryPoint("nope"));

        // Then
        assertThat(diagram.isFallback()).isTrue();
        assertThat(diagram.validationErrors()).containsExactly("Function not found: nope");
        assertThat(new DiagramValidator(Dialect.MERMAID).isValid(diagram.content())).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"plantuml", "dot", "mermaid"})
    void generate_everyViewOfFixture_passesValidation(String dialectId) {
        // Given
        Dialect dialect = Dialect.fromId(dialectId);
        DialectDiagramGenerator generator = new DialectDiagramGenerator(dialect);
        DiagramValidator validator = new DiagramValidator(dialect);
        GeneratorConfig config = GeneratorConfig.defaults().withEntryPoint("main");

        for (DiagramType type : DiagramType.values()) {
            // When
            GeneratedDiagram diagram = generator.generate(geometry, type, config);

            // Then
            assertThat(diagram.validationErrors()).as("%s %s", dialectId, type).isEmpty();
            assertThat(validator.validate(diagram.content())).as("%s %s", dialectId, type).isEmpty();
            assertThat(diagram.fileExtension()).isEqualTo(dialect.fileExtension());
        }
    }

    @Test
    void generate_callGraphWithEntryPoint_namedAfterEntry() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.PLANTUML);

        GeneratedDiagram reachable = generator.generate(geometry, DiagramType.CALL_GRAPH,
            GeneratorConfig.defaults().withEntryPoint("main"));
        GeneratedDiagram whole = generator.generate(geometry, DiagramType.CALL_GRAPH, GeneratorConfig.defaults());

        assertThat(reachable.name()).isEqualTo("call_graph_main");
        assertThat(reachable.content()).contains("title Call Graph from main");
        assertThat(whole.name()).isEqualTo("call_graph");
    }

    @Test
    void generate_plantUmlClassDiagram_listsInheritance() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.PLANTUML);

        String content = generator.generate(geometry, DiagramType.CLASS_DIAGRAM, GeneratorConfig.defaults()).content();

        assertThat(content).contains("class \"geo.Shape\"", "class \"geo.Circle\"", "<<struct>>");
        assertThat(linesStartingWith(content, "n_")).isEqualTo(2);
        assertThat(content).contains(" <|-- ");
    }

    @Test
    void generate_dotCallGraph_containsNodesAndEdges() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.DOT);

        String content = generator.generate(geometry, DiagramType.CALL_GRAPH, GeneratorConfig.defaults()).content();

        assertThat(content).startsWith("digraph G {");
        assertThat(content).contains("rankdir=LR;", "label=\"calls\"", "label=\"geo::isOdd\"");
        assertThat(content).contains(" -> ");
    }

    @Test
    void generate_emptyRegister_rendersPlaceholder() {
        DialectDiagramGenerator generator = new DialectDiagramGenerator(Dialect.MERMAID);

        GeneratedDiagram diagram = generator.generate(EntityRegister.empty(), DiagramType.MODULE_STRUCTURE,
            GeneratorConfig.defaults());

        assertThat(diagram.isFallback()).isFalse();
        assertThat(diagram.content()).contains("No entities found");
    }

    @ParameterizedTest
    @EnumSource(DiagramType.class)
    void getSupportedDiagramTypes_coversAllTypes(DiagramType type) {
        assertThat(new DialectDiagramGenerator(Dialect.DOT).getSupportedDiagramTypes()).contains(type);
    }

    @Test
    void forConfig_appliesDialectAndWidthOverrides() {
        DiagramConfig diagrams = new DiagramConfig("graphviz", null, null, null, null, 20, null);

        DialectDiagramGenerator generator = DialectDiagramGenerator.forConfig(diagrams);

        assertThat(generator.getId()).isEqualTo("dot");
        assertThat(generator.getDialect().labelWidth()).isEqualTo(20);
        assertThat(generator.getDialect().conditionWidth()).isEqualTo(Dialect.DOT.conditionWidth());
    }

    @Test
    void generate_validationFails_emitsFallbackWithErrors() {
        // Given
        DialectDiagramGenerator generator =
            new DialectDiagramGenerator(Dialect.PLANTUML, new DiagramValidator(Dialect.DOT));
        EntityRegister register = register(new SourceUnit("f.cpp", BRANCHING));

        // When
        GeneratedDiagram diagram = generator.generate(register, DiagramType.FUNCTION_FLOW,
            GeneratorConfig.defaults().withEntryPoint("f"));

        // Then
        assertThat(diagram.isFallback()).isTrue();
        assertThat(diagram.name()).isEqualTo("flow_f");
        assertThat(diagram.content()).isEqualTo(generator.fallback("Function Flow - f"));
        assertThat(diagram.validationErrors()).anyMatch(error -> error.contains(Dialect.DOT.startMarker()));
    }

    @Test
    void fallback_isValidInEveryDialect() {
        for (Dialect dialect : List.of(Dialect.PLANTUML, Dialect.DOT, Dialect.MERMAID)) {
            String content = new DialectDiagramGenerator(dialect).fallback("Call Graph");

            assertThat(new DiagramValidator(dialect).validate(content)).as(dialect.id()).isEmpty();
        }
    }
}
