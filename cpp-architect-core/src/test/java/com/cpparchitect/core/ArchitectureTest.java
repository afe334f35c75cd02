package com.cpparchitect.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model depends on no pipeline stage</li>
 *   <li>Only the syntax package touches the tree-sitter binding</li>
 *   <li>Generators work on the model, never on syntax trees</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.cpparchitect.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the pipeline stages that produce or consume it.
     */
    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..syntax..", "..extractor..", "..scanner..", "..graph..", "..generator..", "..renderer..", "..index..");

        rule.check(classes);
    }

    @Test
    void treeSitter_shouldOnlyBeUsedBySyntaxPackage() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..syntax..")
            .should().dependOnClassesThat().resideInAPackage("org.treesitter..");

        rule.check(classes);
    }

    @Test
    void generators_shouldNotDependOnSyntaxOrExtraction() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..generator..", "..graph..", "..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..syntax..", "..extractor..", "..scanner..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..scanner..", "..generator..", "..extractor..");

        rule.check(classes);
    }
}
