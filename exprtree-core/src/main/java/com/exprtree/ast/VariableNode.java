package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Access to a named context variable such as {@code github} or {@code matrix}.
 */
public final class VariableNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final String name;

    public VariableNode(Token token, String name) {
        this.token = Objects.requireNonNull(token, "token");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
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
        return visitor.visitVariable(this);
    }

    @Override
    public String type() {
        return "Variable";
    }

    @Override
    public String toString() {
        return "Variable[" + name + "]";
    }
}
