package com.exprtree;

import com.exprtree.ast.ExprNode;

/**
 * Callback of {@link ExprTreeWalker}. It is called twice for every node: with
 * {@code entering} set to true before the children are visited, and with
 * {@code entering} set to false after them.
 */
@FunctionalInterface
public interface VisitExprNodeFunc {

    /**
     * @param node     visited node
     * @param parent   parent of the node, {@code null} for the root of the walk
     * @param entering true before visiting children, false after
     */
    void visit(ExprNode node, ExprNode parent, boolean entering);
}
