package com.cpparchitect.core.syntax;

/**
 * Boundary to an external concrete-syntax parser.
 *
 * <p>Implementations are not required to be thread-safe. Callers that parse files in
 * parallel create one parser per worker thread.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SyntaxParser parser = new TreeSitterCppParser();
 * SyntaxNode root = parser.parse("int main() { return 0; }");
 * }</pre>
 */
public interface SyntaxParser {

    /**
     * Gets the language this parser supports.
     *
     * @return language identifier, e.g. "cpp"
     */
    String getLanguage();

    /**
     * Parses source text into a syntax tree.
     *
     * <p>Grammar-driven parsers recover from syntax errors with error nodes, so a tree
     * is returned for almost any input. Offsets are UTF-8 byte offsets into {@code source}.
     *
     * @param source complete source text of one file
     * @return root node
     * @throws SyntaxParseException if the parser produced no tree at all
     */
    SyntaxNode parse(String source);

    /**
     * Exception thrown when a parser cannot produce a tree.
     */
    class SyntaxParseException extends RuntimeException {
        public SyntaxParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public SyntaxParseException(String message) {
            super(message);
        }
    }
}
