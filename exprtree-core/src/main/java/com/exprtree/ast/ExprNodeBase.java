package com.exprtree.ast;

import com.exprtree.MalformedExprTreeException;

import java.util.List;

/**
 * Holds the parent link shared by all node variants. The link is written once,
 * by the constructor of the enclosing node.
 */
abstract class ExprNodeBase {

    private ExprNode parent;

    public ExprNode parent() {
        return parent;
    }

    /**
     * Links {@code children} to this node. Either all of them are linked or, when
     * one is already attached or appears twice, none is.
     */
    final void adopt(List<? extends ExprNode> children) {
        for (int i = 0; i < children.size(); i++) {
            ExprNode child = children.get(i);
            ExprNode current = ((ExprNodeBase) child).parent;
            if (current != null) {
                throw new MalformedExprTreeException(
                    child.type() + " node at " + child.token() + " is already attached to "
                        + current.type() + " node at " + current.token());
            }
            for (int j = 0; j < i; j++) {
                if (children.get(j) == child) {
                    throw new MalformedExprTreeException(
                        child.type() + " node at " + child.token() + " is passed twice to one "
                            + ((ExprNode) this).type() + " node");
                }
            }
        }
        for (ExprNode child : children) {
            ((ExprNodeBase) child).parent = (ExprNode) this;
        }
    }
}
