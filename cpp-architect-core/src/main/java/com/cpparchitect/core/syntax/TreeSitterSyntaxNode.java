package com.cpparchitect.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * {@link SyntaxNode} view of a tree-sitter node.
 *
 * <p>Every wrapper holds its {@link TSTree}: the native tree is released once the Java
 * tree object is collected, and nodes must not outlive it.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    private final TSTree tree;
    private final TSNode node;
    private final String fieldName;
    private List<SyntaxNode> children;

    TreeSitterSyntaxNode(TSTree tree, TSNode node, String fieldName) {
        this.tree = tree;
        this.node = node;
        this.fieldName = fieldName;
    }

    @Override
    public String type() {
        return node.getType();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public int startLine() {
        return node.getStartPoint().getRow() + 1;
    }

    @Override
    public int endLine() {
        return node.getEndPoint().getRow() + 1;
    }

    @Override
    public List<SyntaxNode> children() {
        if (children == null) {
            int count = node.getChildCount();
            List<SyntaxNode> result = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                TSNode child = node.getChild(i);
                if (child == null || child.isNull()) {
                    continue;
                }
                result.add(new TreeSitterSyntaxNode(tree, child, node.getFieldNameForChild(i)));
            }
            children = Collections.unmodifiableList(result);
        }
        return children;
    }

    @Override
    public String fieldName() {
        return fieldName;
    }

    @Override
    public String toString() {
        return type() + "[" + startByte() + ".." + endByte() + "]";
    }
}
