package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

public final class IntNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final long value;

    public IntNode(Token token, long value) {
        this.token = Objects.requireNonNull(token, "token");
        this.value = value;
    }

    public long value() {
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
        return visitor.visitInt(this);
    }

    @Override
    public String type() {
        return "Int";
    }

    @Override
    public String toString() {
        return "Int[" + value + "]";
    }
}
