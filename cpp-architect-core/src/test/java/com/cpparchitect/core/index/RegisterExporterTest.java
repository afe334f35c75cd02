package com.cpparchitect.core.index;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.SourceUnit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static com.cpparchitect.core.CppFixtures.register;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RegisterExporter}.
 */
class RegisterExporterTest {

    private static final String SOURCE = """
        class Base { };
        class Derived : public Base {
        public:
            int run(int n) {
                if (n > 0) {
                    return helper(n);
                }
                return 0;
            }
        };
        int helper(int n) { return n; }
        """;

    @TempDir
    Path tempDir;

    private final RegisterExporter exporter = new RegisterExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toJson_containsEntitiesEdgesAndStatistics() throws IOException {
        // Given
        EntityRegister register = register(new SourceUnit("app.cpp", SOURCE));

        // When
        JsonNode root = mapper.readTree(exporter.toJson(register));

        // Then
        assertThat(root.get("files")).hasSize(1);
        assertThat(root.get("functions")).hasSize(2);
        assertThat(root.get("classes")).hasSize(2);

        JsonNode run = root.get("functions").get(0);
        assertThat(run.get("qualifiedName").asText()).isEqualTo("Derived::run");
        assertThat(run.get("owningClass").asText()).isEqualTo("Derived");
        JsonNode conditional = run.get("controlFlow").get(0);
        assertThat(conditional.get("type").asText()).isEqualTo("conditional");
        assertThat(conditional.get("then").get(0).get("type").asText()).isEqualTo("return");

        assertThat(root.get("callEdges")).hasSize(1);
        assertThat(root.get("callEdges").get(0).get("target").asText()).startsWith("helper@app.cpp");
        assertThat(root.get("classes").get(1).get("baseClasses").get(0).asText()).isEqualTo("Base");

        JsonNode statistics = root.get("statistics");
        assertThat(statistics.get("totalFunctions").asInt()).isEqualTo(2);
        assertThat(statistics.get("totalClasses").asInt()).isEqualTo(2);
        assertThat(statistics.get("extraction").get("filesParsed").asInt()).isEqualTo(1);
    }

    @Test
    void toJson_unresolvedReferencesListed() throws IOException {
        EntityRegister register = register(new SourceUnit("x.cpp", "void f() { printf(\"hi\"); }"));

        JsonNode unresolved = mapper.readTree(exporter.toJson(register)).get("unresolved");

        assertThat(unresolved).hasSize(1);
        assertThat(unresolved.get(0).get("target").asText()).isEqualTo("printf");
        assertThat(unresolved.get(0).get("kind").asText()).isEqualTo("CALL");
        assertThat(unresolved.get(0).get("reason").asText()).isEqualTo("UNKNOWN");
    }

    @Test
    void export_writesFileCreatingParents() throws IOException {
        // Given
        Path target = tempDir.resolve("out/" + RegisterExporter.DEFAULT_FILE_NAME);

        // When
        exporter.export(EntityRegister.empty(), target);

        // Then
        JsonNode root = mapper.readTree(target.toFile());
        assertThat(root.get("functions")).isEmpty();
        assertThat(root.get("statistics").get("totalFunctions").asInt()).isZero();
    }
}
