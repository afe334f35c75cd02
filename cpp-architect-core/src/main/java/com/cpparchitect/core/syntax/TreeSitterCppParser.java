package com.cpparchitect.core.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCpp;

/**
 * C++ parser backed by the tree-sitter C++ grammar.
 *
 * <p>Not thread-safe: a {@link TSParser} keeps native parse state. Create one instance
 * per thread.
 */
public class TreeSitterCppParser implements SyntaxParser {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterCppParser.class);

    private final TSParser parser;

    public TreeSitterCppParser() {
        this.parser = new TSParser();
        this.parser.setLanguage(new TreeSitterCpp());
    }

    @Override
    public String getLanguage() {
        return "cpp";
    }

    @Override
    public SyntaxNode parse(String source) {
        if (source == null) {
            throw new SyntaxParseException("source must not be null");
        }
        TSTree tree = parser.parseString(null, source);
        if (tree == null) {
            throw new SyntaxParseException("tree-sitter returned no tree");
        }
        log.trace("Parsed {} chars of C++ source", source.length());
        return new TreeSitterSyntaxNode(tree, tree.getRootNode(), null);
    }
}
