package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Binary comparison; {@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >} or {@code >=}.
 */
public final class CompareOpNode extends ExprNodeBase implements ExprNode {
    private final CompareOpNodeKind kind;
    private final ExprNode left;
    private final ExprNode right;

    public CompareOpNode(CompareOpNodeKind kind, ExprNode left, ExprNode right) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        adopt(List.of(left, right));
    }

    public CompareOpNodeKind kind() {
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
        return visitor.visitCompareOp(this);
    }

    @Override
    public String type() {
        return "CompareOp";
    }

    @Override
    public String toString() {
        return "CompareOp[" + left + " " + kind + " " + right + "]";
    }
}
