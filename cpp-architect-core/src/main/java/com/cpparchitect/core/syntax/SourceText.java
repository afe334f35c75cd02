package com.cpparchitect.core.syntax;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Source text of one file with slicing by UTF-8 byte offsets.
 *
 * <p>Syntax trees report byte offsets, which diverge from Java char indices as soon as
 * the file contains non-ASCII characters (comments in other languages, string literals).
 * All slicing therefore goes through the encoded bytes.
 */
public final class SourceText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String text;
    private final byte[] utf8;

    public SourceText(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8.length;
    }

    /**
     * Returns the exact source text covered by a node.
     *
     * @param node syntax node of this source
     * @return covered text, empty for empty or out-of-range spans
     */
    public String of(SyntaxNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return slice(node.startByte(), node.endByte());
    }

    /**
     * Returns the text between two byte offsets, clamped to the source bounds.
     *
     * @param startByte inclusive start offset
     * @param endByte exclusive end offset
     * @return decoded text
     */
    public String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, utf8.length));
        int end = Math.max(start, Math.min(endByte, utf8.length));
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Returns node text with every whitespace run collapsed to one space.
     *
     * @param node syntax node of this source
     * @return normalized text
     */
    public String condensed(SyntaxNode node) {
        return condense(of(node));
    }

    /**
     * Collapses whitespace runs, including newlines, to single spaces and trims.
     *
     * @param value raw text
     * @return normalized text
     */
    public static String condense(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
