package com.cpparchitect.core.extractor;

import org.junit.jupiter.api.Test;

import com.cpparchitect.core.model.ClassKind;
import com.cpparchitect.core.model.CppClass;
import com.cpparchitect.core.model.CppFunction;

import static com.cpparchitect.core.CppFixtures.extract;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EntityExtractor}.
 */
class EntityExtractorTest {

    @Test
    void extract_freeFunction_capturesSignatureAndLines() {
        // Given
        String code = """
            // leading comment
            double area(double r, int unused) {
                return 3.14 * r * r;
            }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.functions()).hasSize(1);
        CppFunction function = extraction.functions().get(0);
        assertThat(function.name()).isEqualTo("area");
        assertThat(function.qualifiedName()).isEqualTo("area");
        assertThat(function.returnType()).isEqualTo("double");
        assertThat(function.parameters()).containsExactly("double r", "int unused");
        assertThat(function.fileId()).isEqualTo("test.cpp");
        assertThat(function.lines().startLine()).isEqualTo(2);
        assertThat(function.lines().endLine()).isEqualTo(4);
        assertThat(function.isMethod()).isFalse();
    }

    @Test
    void extract_nestedNamespaces_qualifiesNames() {
        // Given
        String code = """
            namespace outer {
            namespace inner {
            int f() { return 1; }
            }
            namespace {
            int hidden() { return 2; }
            }
            }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.functions())
            .extracting(CppFunction::qualifiedName)
            .containsExactly("outer::inner::f", "outer::hidden");
    }

    @Test
    void extract_classWithInlineMethods_listsMethodsOnClassAndAsFunctions() {
        // Given
        String code = """
            namespace geo {
            class Circle : public Shape {
            public:
                double area() const { return 3.0 * r * r; }
                void scale(double k) { r = r * k; }
            private:
                double r;
            };
            }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.classes()).hasSize(1);
        CppClass circle = extraction.classes().get(0);
        assertThat(circle.name()).isEqualTo("Circle");
        assertThat(circle.qualifiedName()).isEqualTo("geo::Circle");
        assertThat(circle.kind()).isEqualTo(ClassKind.CLASS);
        assertThat(circle.baseClasses()).containsExactly("Shape");
        assertThat(circle.methods()).extracting(CppFunction::name).containsExactly("area", "scale");

        assertThat(extraction.functions())
            .extracting(CppFunction::qualifiedName)
            .containsExactly("geo::Circle::area", "geo::Circle::scale");
        assertThat(extraction.functions()).allSatisfy(method -> assertThat(method.owningClass()).isEqualTo("Circle"));
    }

    @Test
    void extract_struct_recordsStructKind() {
        FileExtraction extraction = extract("struct Point { int x; int y; };");

        assertThat(extraction.classes()).singleElement()
            .satisfies(point -> {
                assertThat(point.kind()).isEqualTo(ClassKind.STRUCT);
                assertThat(point.methods()).isEmpty();
                assertThat(point.baseClasses()).isEmpty();
            });
    }

    @Test
    void extract_outOfLineMemberDefinition_setsOwningClass() {
        // Given
        String code = """
            namespace geo {
            void Shape::draw(int scale) {
                render(scale);
            }
            }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        CppFunction draw = extraction.functions().get(0);
        assertThat(draw.name()).isEqualTo("draw");
        assertThat(draw.qualifiedName()).isEqualTo("geo::Shape::draw");
        assertThat(draw.owningClass()).isEqualTo("Shape");
        assertThat(draw.calls()).containsExactly("render");
    }

    @Test
    void extract_pointerReturningFunction_unwrapsDeclarator() {
        FileExtraction extraction = extract("char* name(int id) { return nullptr; }");

        assertThat(extraction.functions()).singleElement()
            .satisfies(function -> {
                assertThat(function.name()).isEqualTo("name");
                assertThat(function.parameters()).containsExactly("int id");
            });
    }

    @Test
    void extract_callees_inPreOrderOnePerCallSite() {
        // Given
        String code = """
            void run() {
                init();
                process(load(1), load(2));
                if (ready()) {
                    ns::finish();
                }
            }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.functions().get(0).calls())
            .containsExactly("init", "process", "load", "load", "ready", "ns::finish");
    }

    @Test
    void extract_forwardDeclarations_areIgnoredWithoutCounting() {
        // Given
        String code = """
            class Later;
            int declared(int a);
            int defined(int a) { return a; }
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.classes()).isEmpty();
        assertThat(extraction.functions()).extracting(CppFunction::name).containsExactly("defined");
        assertThat(extraction.skippedEntities()).isEmpty();
    }

    @Test
    void extract_anonymousStruct_isSkippedAndCountedButMembersStillVisited() {
        // Given
        String code = """
            struct {
                int value() { return 1; }
            } instance;
            """;

        // When
        FileExtraction extraction = extract(code);

        // Then
        assertThat(extraction.classes()).isEmpty();
        assertThat(extraction.skippedEntities()).containsEntry(EntityExtractor.SKIP_MISSING_NAME, 1);
        assertThat(extraction.functions()).extracting(CppFunction::name).containsExactly("value");
        assertThat(extraction.errors()).hasSize(1);
    }

    @Test
    void extract_emptyFile_returnsNothing() {
        FileExtraction extraction = extract("");

        assertThat(extraction.functions()).isEmpty();
        assertThat(extraction.classes()).isEmpty();
    }

    @Test
    void extract_isDeterministic() {
        String code = """
            namespace a { int f(int x) { if (x) { return g(x); } return 0; } }
            struct B { void h() { f(1); } };
            """;

        assertThat(extract(code)).isEqualTo(extract(code));
    }
}
