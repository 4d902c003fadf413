package com.exprtree.ast;

/**
 * Visitor over the node variants. Adding a variant adds a method here, so every
 * implementation has to handle it.
 *
 * @param <R> result type
 */
public interface ExprNodeVisitor<R> {
    R visitVariable(VariableNode node);

    R visitNull(NullNode node);

    R visitBool(BoolNode node);

    R visitInt(IntNode node);

    R visitFloat(FloatNode node);

    R visitString(StringNode node);

    R visitObjectDeref(ObjectDerefNode node);

    R visitArrayDeref(ArrayDerefNode node);

    R visitIndexAccess(IndexAccessNode node);

    R visitNotOp(NotOpNode node);

    R visitCompareOp(CompareOpNode node);

    R visitLogicalOp(LogicalOpNode node);

    R visitFuncCall(FuncCallNode node);
}
