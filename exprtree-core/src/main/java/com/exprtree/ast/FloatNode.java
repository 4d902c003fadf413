package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

public final class FloatNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final double value;

    public FloatNode(Token token, double value) {
        this.token = Objects.requireNonNull(token, "token");
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public Token token() {
        return token;
    }

    @Override
    public List<ExprNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitFloat(this);
    }

    @Override
    public String type() {
        return "Float";
    }

    @Override
    public String toString() {
        return "Float[" + value + "]";
    }
}
