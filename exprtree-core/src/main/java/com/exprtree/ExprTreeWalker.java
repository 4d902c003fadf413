package com.exprtree;

import com.exprtree.ast.ArrayDerefNode;
import com.exprtree.ast.BoolNode;
import com.exprtree.ast.CompareOpNode;
import com.exprtree.ast.ExprNode;
import com.exprtree.ast.ExprNodeVisitor;
import com.exprtree.ast.FloatNode;
import com.exprtree.ast.FuncCallNode;
import com.exprtree.ast.IndexAccessNode;
import com.exprtree.ast.IntNode;
import com.exprtree.ast.LogicalOpNode;
import com.exprtree.ast.NotOpNode;
import com.exprtree.ast.NullNode;
import com.exprtree.ast.ObjectDerefNode;
import com.exprtree.ast.StringNode;
import com.exprtree.ast.VariableNode;

import java.util.Objects;

/**
 * Depth-first walker over expression trees.
 *
 * <p>Children are visited in a fixed order per node variant:</p>
 * <ul>
 *   <li>ObjectDeref, ArrayDeref: receiver</li>
 *   <li>IndexAccess: index, then operand</li>
 *   <li>NotOp: operand</li>
 *   <li>CompareOp, LogicalOp: left, then right</li>
 *   <li>FuncCall: arguments in order</li>
 * </ul>
 *
 * <p>The index of an IndexAccess is visited before its operand so that taint
 * analyses know whether the index comes from untrusted input by the time they
 * see the accessed object.</p>
 *
 * <p>A walk cannot be stopped from the callback. Callers wanting an early exit
 * keep their own flag and ignore the remaining calls.</p>
 */
public final class ExprTreeWalker {

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final ExprTreeWalker DEFAULT = new ExprTreeWalker(DEFAULT_MAX_DEPTH);

    private final int maxDepth;

    /**
     * @param maxDepth deepest nesting the walker descends into; the root is at depth 1
     */
    public ExprTreeWalker(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive but was " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public static ExprTreeWalker defaultWalker() {
        return DEFAULT;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Visits the tree rooted at {@code root}. The root is reported with a {@code null} parent.
     *
     * @throws MalformedExprTreeException if the tree is nested deeper than {@link #maxDepth()}
     */
    public void walk(ExprNode root, VisitExprNodeFunc func) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(func, "func");
        visit(root, null, func, 1);
    }

    private void visit(ExprNode node, ExprNode parent, VisitExprNodeFunc func, int depth) {
        if (depth > maxDepth) {
            throw new MalformedExprTreeException(
                "expression at " + node.token() + " is nested deeper than " + maxDepth + " levels");
        }
        func.visit(node, parent, true);
        node.accept(new ChildVisitor(func, depth + 1));
        func.visit(node, parent, false);
    }

    private final class ChildVisitor implements ExprNodeVisitor<Void> {
        private final VisitExprNodeFunc func;
        private final int depth;

        ChildVisitor(VisitExprNodeFunc func, int depth) {
            this.func = func;
            this.depth = depth;
        }

        private void child(ExprNode child, ExprNode parent) {
            visit(child, parent, func, depth);
        }

        @Override
        public Void visitVariable(VariableNode node) {
            return null;
        }

        @Override
        public Void visitNull(NullNode node) {
            return null;
        }

        @Override
        public Void visitBool(BoolNode node) {
            return null;
        }

        @Override
        public Void visitInt(IntNode node) {
            return null;
        }

        @Override
        public Void visitFloat(FloatNode node) {
            return null;
        }

        @Override
        public Void visitString(StringNode node) {
            return null;
        }

        @Override
        public Void visitObjectDeref(ObjectDerefNode node) {
            child(node.receiver(), node);
            return null;
        }

        @Override
        public Void visitArrayDeref(ArrayDerefNode node) {
            child(node.receiver(), node);
            return null;
        }

        @Override
        public Void visitIndexAccess(IndexAccessNode node) {
            // index first, see class comment
            child(node.index(), node);
            child(node.operand(), node);
            return null;
        }

        @Override
        public Void visitNotOp(NotOpNode node) {
            child(node.operand(), node);
            return null;
        }

        @Override
        public Void visitCompareOp(CompareOpNode node) {
            child(node.left(), node);
            child(node.right(), node);
            return null;
        }

        @Override
        public Void visitLogicalOp(LogicalOpNode node) {
            child(node.left(), node);
            child(node.right(), node);
            return null;
        }

        @Override
        public Void visitFuncCall(FuncCallNode node) {
            for (ExprNode arg : node.args()) {
                child(arg, node);
            }
            return null;
        }
    }
}
