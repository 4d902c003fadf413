package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Boolean literal, {@code true} or {@code false}.
 */
public final class BoolNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final boolean value;

    public BoolNode(Token token, boolean value) {
        this.token = Objects.requireNonNull(token, "token");
        this.value = value;
    }

    public boolean value() {
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
        return visitor.visitBool(this);
    }

    @Override
    public String type() {
        return "Bool";
    }

    @Override
    public String toString() {
        return "Bool[" + value + "]";
    }
}
