package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * String literal. The value has escapes resolved and the quotes at both ends
 * removed; the raw text stays available through {@link Token#lexeme()}.
 */
public final class StringNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final String value;

    public StringNode(Token token, String value) {
        this.token = Objects.requireNonNull(token, "token");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String value() {
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
        return visitor.visitString(this);
    }

    @Override
    public String type() {
        return "String";
    }

    @Override
    public String toString() {
        return "String['" + value + "']";
    }
}
