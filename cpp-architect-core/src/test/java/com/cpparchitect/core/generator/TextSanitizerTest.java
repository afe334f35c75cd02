package com.cpparchitect.core.generator;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TextSanitizer}.
 */
class TextSanitizerTest {

    private final TextSanitizer plantUml = new TextSanitizer(Dialect.PLANTUML);

    private static final List<String> SAMPLES = List.of(
        "",
        "   ",
        "()",
        "geo::Shape::area",
        "(a > 0 && b < 1)",
        "(a) && (b)",
        "std::vector<int> v; v.push_back(1);",
        "x || y | z",
        "\"quoted\" \\ `tick` [idx] {block} ~dtor @user #tag",
        "a\u0000b\u0007c",
        "((nested))",
        "a".repeat(200),
        "(" + "b".repeat(120) + ")",
        "line one\n\tline two",
        "emoji 😀".repeat(20),
        "\u2028",
        "\u00A0",
        "\u3000 \u2029",
        "a\u00A0\u00A0b\u2028c",
        "(s[0] == ')' || s[0] == '(')",
        "(it's)"
    );

    static Stream<Arguments> dialectsContextsAndSamples() {
        return Stream.of(Dialect.PLANTUML, Dialect.DOT, Dialect.MERMAID)
            .flatMap(dialect -> Stream.of(SanitizationContext.values())
                .flatMap(context -> SAMPLES.stream().map(sample -> Arguments.of(dialect, context, sample))));
    }

    @ParameterizedTest
    @MethodSource("dialectsContextsAndSamples")
    void sanitize_isIdempotentAndNeverEmpty(Dialect dialect, SanitizationContext context, String sample) {
        TextSanitizer sanitizer = new TextSanitizer(dialect);

        String once = sanitizer.sanitize(sample, context);
        String twice = sanitizer.sanitize(once, context);

        assertThat(once).isNotEmpty();
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void label_plantUml_remapsActivitySyntax() {
        assertThat(plantUml.label("geo::Shape::area")).isEqualTo("geo.Shape.area");
        assertThat(plantUml.label("a; b")).isEqualTo("a, b");
        assertThat(plantUml.label("key:value")).isEqualTo("key value");
        assertThat(plantUml.label("x | y")).isEqualTo("x / y");
        assertThat(plantUml.label("say \"hi\"")).isEqualTo("say 'hi'");
    }

    @Test
    void condition_plantUml_spellsOutLogicalOr() {
        assertThat(plantUml.condition("a || b")).isEqualTo("a or b");
    }

    @Test
    void label_longText_truncatedToWidthWithEllipsis() {
        // When
        String result = plantUml.label("x".repeat(200));

        // Then
        assertThat(result).hasSize(Dialect.PLANTUML.labelWidth());
        assertThat(result).endsWith(TextSanitizer.ELLIPSIS);
    }

    @Test
    void condition_usesConditionWidth() {
        String result = plantUml.condition("c".repeat(100));

        assertThat(result).hasSizeLessThanOrEqualTo(Dialect.PLANTUML.conditionWidth());
        assertThat(result).endsWith(TextSanitizer.ELLIPSIS);
    }

    @Test
    void label_textWithinWidth_keptIntact() {
        String text = "y".repeat(Dialect.PLANTUML.labelWidth());

        assertThat(plantUml.label(text)).isEqualTo(text);
    }

    @Test
    void truncate_neverSplitsSurrogatePair() {
        String text = "z".repeat(46) + "😀" + "tail";

        String result = plantUml.label(text);

        assertThat(result).endsWith(TextSanitizer.ELLIPSIS);
        assertThat(Character.isHighSurrogate(result.charAt(result.length() - 4))).isFalse();
    }

    @Test
    void condition_wrappingParentheses_stripped() {
        assertThat(plantUml.condition("(a > 0)")).isEqualTo("a > 0");
        assertThat(plantUml.condition("((a > 0))")).isEqualTo("a > 0");
    }

    @Test
    void condition_bracketsInsideCharacterLiterals_ignoredWhenStripping() {
        TextSanitizer dot = new TextSanitizer(Dialect.DOT);

        assertThat(dot.condition("(s[0] == ')' || s[0] == '(')")).isEqualTo("s[0] == ')' || s[0] == '('");
        assertThat(plantUml.condition("(s[0] == ')' || s[0] == '(')")).isEqualTo("s(0) == ')' or s(0) == '('");
        TextSanitizer mermaid = new TextSanitizer(Dialect.MERMAID);
        assertThat(mermaid.condition("(c == '\\'' || c == ')')")).isEqualTo("c == '\\'' // c == ')'");
    }

    @Test
    void condition_unterminatedQuote_countsEveryBracket() {
        assertThat(plantUml.condition("(it's)")).isEqualTo("it's");
        assertThat(plantUml.condition("(it's) && (b)")).isEqualTo("(it's) && (b)");
    }

    @Test
    void condition_independentParenthesizedGroups_kept() {
        assertThat(plantUml.condition("(a) && (b)")).isEqualTo("(a) && (b)");
    }

    @Test
    void sanitize_controlCharactersAndWhitespace_normalized() {
        assertThat(plantUml.label("a\u0000b")).isEqualTo("a b");
        assertThat(plantUml.label("  one \n\t two  ")).isEqualTo("one two");
        assertThat(plantUml.label("a\u00A0\u00A0b\u2028c")).isEqualTo("a b c");
    }

    @Test
    void sanitize_emptyResults_useFallbackTokens() {
        assertThat(plantUml.label(null)).isEqualTo(TextSanitizer.LABEL_FALLBACK);
        assertThat(plantUml.label("   ")).isEqualTo(TextSanitizer.LABEL_FALLBACK);
        assertThat(plantUml.condition("( )")).isEqualTo(TextSanitizer.CONDITION_FALLBACK);
        assertThat(plantUml.label("\u2028")).isEqualTo(TextSanitizer.LABEL_FALLBACK);
        assertThat(plantUml.condition("\u2028")).isEqualTo(TextSanitizer.CONDITION_FALLBACK);
        assertThat(plantUml.label("\u00A0")).isEqualTo(TextSanitizer.LABEL_FALLBACK);
        assertThat(plantUml.condition("(\u00A0\u3000)")).isEqualTo(TextSanitizer.CONDITION_FALLBACK);
        assertThat(plantUml.filename("::")).isEqualTo(TextSanitizer.FILENAME_FALLBACK);
    }

    @Test
    void filename_keepsWordCharactersAndCollapsesUnderscores() {
        assertThat(plantUml.filename("flow_geo::Shape::area")).isEqualTo("flow_geo_Shape_area");
        assertThat(plantUml.filename("__a  b..c__")).isEqualTo("a_b_c");
    }

    @Test
    void filename_longName_truncatedWithoutMarker() {
        String result = plantUml.filename("f".repeat(100));

        assertThat(result).hasSize(Dialect.PLANTUML.filenameWidth());
        assertThat(result).doesNotContain(TextSanitizer.ELLIPSIS);
    }

    @Test
    void label_mermaid_escapesHtmlAndEntityStarts() {
        TextSanitizer mermaid = new TextSanitizer(Dialect.MERMAID);

        assertThat(mermaid.label("vector<int> #1")).doesNotContain("<", ">", "#");
    }

    @Test
    void label_dot_replacesQuotesAndBackslashes() {
        TextSanitizer dot = new TextSanitizer(Dialect.DOT);

        assertThat(dot.label("printf(\"%d\\n\")")).isEqualTo("printf('%d/n')");
    }
}
