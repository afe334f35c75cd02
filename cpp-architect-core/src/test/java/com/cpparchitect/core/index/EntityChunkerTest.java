package com.cpparchitect.core.index;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cpparchitect.core.index.CodeChunk.ChunkType;
import com.cpparchitect.core.model.EntityRegister;
import com.cpparchitect.core.model.LineRange;
import com.cpparchitect.core.model.SourceUnit;

import static com.cpparchitect.core.CppFixtures.register;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EntityChunker}.
 */
class EntityChunkerTest {

    private static final String SOURCE = """
        namespace geo {
        struct Point : Base {
            int norm(int scale) { return scale; }
        };
        int twice(int x) {
            log(x);
            log(x);
            return x * 2;
        }
        }
        """;

    private final EntityChunker chunker = new EntityChunker();

    @Test
    void chunk_functionsFirstThenClasses() {
        // Given
        EntityRegister register = register(new SourceUnit("geo.cpp", SOURCE));

        // When
        List<CodeChunk> chunks = chunker.chunk(register);

        // Then
        assertThat(chunks).extracting(CodeChunk::type)
            .containsExactly(ChunkType.FUNCTION, ChunkType.FUNCTION, ChunkType.CLASS);
        assertThat(chunks).extracting(CodeChunk::name)
            .containsExactly("geo::Point::norm", "geo::twice", "geo::Point");
    }

    @Test
    void chunk_functionContentAndMetadata() {
        // Given
        EntityRegister register = register(new SourceUnit("geo.cpp", SOURCE));

        // When
        CodeChunk twice = chunker.chunk(register).get(1);

        // Then
        assertThat(twice.content())
            .startsWith("Function: geo::twice\nReturn Type: int\nParameters: int x\nFile: geo.cpp\nLine: 5\n\n")
            .contains("return x * 2;");
        assertThat(twice.metadata())
            .containsEntry(EntityChunker.KEY_TYPE, "function")
            .containsEntry(EntityChunker.KEY_NAME, "twice")
            .containsEntry(EntityChunker.KEY_LINE_START, 5)
            .containsEntry(EntityChunker.KEY_LINE_END, 9)
            .containsEntry(EntityChunker.KEY_IS_METHOD, false)
            .containsEntry(EntityChunker.KEY_CALLS, List.of("log"));
    }

    @Test
    void chunk_methodNamesOwningClass() {
        EntityRegister register = register(new SourceUnit("geo.cpp", SOURCE));

        CodeChunk norm = chunker.chunk(register).get(0);

        assertThat(norm.content()).contains("Class: Point\n");
        assertThat(norm.metadata())
            .containsEntry(EntityChunker.KEY_CLASS_NAME, "Point")
            .containsEntry(EntityChunker.KEY_IS_METHOD, true);
    }

    @Test
    void chunk_classContentListsBasesAndMethods() {
        EntityRegister register = register(new SourceUnit("geo.cpp", SOURCE));

        CodeChunk point = chunker.chunk(register).get(2);

        assertThat(point.content())
            .contains("Class: geo::Point\n", "Kind: struct\n", "Base Classes: Base\n", "  - norm(int scale) -> int\n");
        assertThat(point.metadata())
            .containsEntry(EntityChunker.KEY_KIND, "struct")
            .containsEntry(EntityChunker.KEY_BASE_CLASSES, List.of("Base"))
            .containsEntry(EntityChunker.KEY_METHOD_COUNT, 1);
    }

    @Test
    void chunk_emptyRegister_noChunks() {
        assertThat(chunker.chunk(EntityRegister.empty())).isEmpty();
    }

    @Test
    void excerpt_rangeBeyondFile_clamped() {
        String[] lines = {"a", "b", "c"};

        assertThat(EntityChunker.excerpt(lines, new LineRange(2, 10))).isEqualTo("b\nc");
        assertThat(EntityChunker.excerpt(lines, new LineRange(7, 9))).isEmpty();
        assertThat(EntityChunker.excerpt(null, new LineRange(1, 1))).isEmpty();
    }
}
