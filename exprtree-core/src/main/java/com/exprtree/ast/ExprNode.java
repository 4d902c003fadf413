package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Optional;

/**
 * Base interface for all expression syntax tree nodes.
 *
 * <p>Trees are built bottom-up: a node's constructor links every child it is
 * given back to itself, so {@link #parent()} is known once the enclosing node
 * exists. Nothing is mutated afterwards.</p>
 */
public sealed interface ExprNode permits
    VariableNode,
    NullNode,
    BoolNode,
    IntNode,
    FloatNode,
    StringNode,
    ObjectDerefNode,
    ArrayDerefNode,
    IndexAccessNode,
    NotOpNode,
    CompareOpNode,
    LogicalOpNode,
    FuncCallNode {

    /**
     * Name of the node variant, e.g. {@code "Variable"} or {@code "IndexAccess"}.
     */
    String type();

    /**
     * Returns the first token of the node. Use it to get the position of the node.
     * Nodes which start with a sub-expression return the first token of that sub-expression.
     */
    Token token();

    /**
     * Returns the node enclosing this node, or {@code null} when this node is the root.
     */
    ExprNode parent();

    default Optional<ExprNode> parentNode() {
        return Optional.ofNullable(parent());
    }

    /**
     * Direct children in the order they appear in the source.
     */
    List<ExprNode> children();

    <R> R accept(ExprNodeVisitor<R> visitor);
}
