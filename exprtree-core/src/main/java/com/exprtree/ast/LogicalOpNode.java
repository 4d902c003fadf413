package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Logical binary operator; {@code &&} or {@code ||}.
 */
public final class LogicalOpNode extends ExprNodeBase implements ExprNode {
    private final LogicalOpNodeKind kind;
    private final ExprNode left;
    private final ExprNode right;

    public LogicalOpNode(LogicalOpNodeKind kind, ExprNode left, ExprNode right) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        adopt(List.of(left, right));
    }

    public LogicalOpNodeKind kind() {
        return kind;
    }

    public ExprNode left() {
        return left;
    }

    public ExprNode right() {
        return right;
    }

    @Override
    public Token token() {
        return left.token();
    }

    @Override
    public List<ExprNode> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitLogicalOp(this);
    }

    @Override
    public String type() {
        return "LogicalOp";
    }

    @Override
    public String toString() {
        return "LogicalOp[" + left + " " + kind + " " + right + "]";
    }
}
