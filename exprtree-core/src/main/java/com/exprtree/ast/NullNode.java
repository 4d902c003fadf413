package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

public final class NullNode extends ExprNodeBase implements ExprNode {
    private final Token token;

    public NullNode(Token token) {
        this.token = Objects.requireNonNull(token, "token");
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
        return visitor.visitNull(this);
    }

    @Override
    public String type() {
        return "Null";
    }

    @Override
    public String toString() {
        return "Null";
    }
}
