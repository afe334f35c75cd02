package com.cpparchitect.core.model;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import static com.cpparchitect.core.CppFixtures.register;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RegisterStatistics}.
 */
class RegisterStatisticsTest {

    @Test
    void of_countsFunctionsClassesAndMethodsPerFile() {
        // Given
        EntityRegister register = register(
            new SourceUnit("a.hpp", "class A { void f() {} void g() {} };\nstruct B { };\n"),
            new SourceUnit("main.cpp", "int main() { return 0; }\n"));

        // When
        RegisterStatistics statistics = RegisterStatistics.of(register);

        // Then
        assertThat(statistics.totalFunctions()).isEqualTo(3);
        assertThat(statistics.totalClasses()).isEqualTo(2);
        assertThat(statistics.totalMethods()).isEqualTo(2);
        assertThat(statistics.avgMethodsPerClass()).isEqualTo(1.0);
        assertThat(statistics.functionsByFile()).containsEntry("a.hpp", 2).containsEntry("main.cpp", 1);
        assertThat(statistics.classesByFile()).containsOnlyKeys("a.hpp");
        assertThat(statistics.extraction().filesParsed()).isEqualTo(2);
    }

    @Test
    void of_emptyRegister_zeroAverage() {
        RegisterStatistics statistics = RegisterStatistics.of(EntityRegister.empty());

        assertThat(statistics.totalFunctions()).isZero();
        assertThat(statistics.avgMethodsPerClass()).isZero();
        assertThat(statistics.functionsByFile()).isEmpty();
    }

    @Test
    void extractionStatistics_totalsAndParseRate() {
        // Given
        ExtractionStatistics statistics = new ExtractionStatistics(4, 3,
            Map.of("oversized", 1), Map.of("missing-name", 2, "missing-body", 1), List.of("boom"));

        // Then
        assertThat(statistics.totalFilesSkipped()).isEqualTo(1);
        assertThat(statistics.totalEntitiesSkipped()).isEqualTo(3);
        assertThat(statistics.getParseRate()).isEqualTo(75.0);
        assertThat(statistics.getSummary()).contains("Discovered: 4", "Parsed: 3", "Entities skipped: 3");
    }

    @Test
    void extractionStatistics_topErrorsCapped() {
        List<String> errors = IntStream.range(0, 25).mapToObj(i -> "error " + i).toList();

        ExtractionStatistics statistics = new ExtractionStatistics(0, 0, null, null, errors);

        assertThat(statistics.topErrors()).hasSize(ExtractionStatistics.MAX_TOP_ERRORS).startsWith("error 0");
        assertThat(statistics.getParseRate()).isZero();
    }
}
