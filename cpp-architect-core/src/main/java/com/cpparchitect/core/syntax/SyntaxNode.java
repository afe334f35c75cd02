package com.cpparchitect.core.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A node of a concrete syntax tree produced by an external parser.
 *
 * <p>Nodes carry a type tag from the grammar's vocabulary (see {@link CppNodeTypes}),
 * UTF-8 byte offsets into the source, 1-based line numbers and ordered children.
 * Anonymous tokens such as {@code "("} or {@code "for"} are children too, with
 * {@link #isNamed()} returning false.
 */
public interface SyntaxNode {

    String type();

    boolean isNamed();

    int startByte();

    int endByte();

    /**
     * @return 1-based line of the first byte
     */
    int startLine();

    /**
     * @return 1-based line of the last byte
     */
    int endLine();

    /**
     * @return all children, named and anonymous, in source order
     */
    List<SyntaxNode> children();

    /**
     * Name of the grammar field this node occupies in its parent.
     *
     * @return field name, or null when the node is not in a field
     */
    String fieldName();

    /**
     * Returns the first child stored under the given grammar field.
     *
     * @param field field name, e.g. {@code "declarator"}
     * @return the child, or empty if the field is absent
     */
    default Optional<SyntaxNode> childByField(String field) {
        return children().stream()
            .filter(child -> field.equals(child.fieldName()))
            .findFirst();
    }

    /**
     * Returns the first direct child whose type is one of the given types.
     *
     * @param types accepted type tags
     * @return the child, or empty if none matches
     */
    default Optional<SyntaxNode> firstChildOfType(String... types) {
        List<String> accepted = Arrays.asList(types);
        return children().stream()
            .filter(child -> accepted.contains(child.type()))
            .findFirst();
    }

    /**
     * Returns all direct children whose type is one of the given types.
     *
     * @param types accepted type tags
     * @return matching children in source order
     */
    default List<SyntaxNode> childrenOfType(String... types) {
        List<String> accepted = Arrays.asList(types);
        return children().stream()
            .filter(child -> accepted.contains(child.type()))
            .toList();
    }

    default boolean is(String nodeType) {
        return type().equals(nodeType);
    }
}
