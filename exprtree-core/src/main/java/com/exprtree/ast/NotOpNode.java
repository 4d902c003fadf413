package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Unary {@code !} operator, the only unary operator of the language.
 */
public final class NotOpNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final ExprNode operand;

    /**
     * @param token   the {@code !} token
     * @param operand negated expression
     */
    public NotOpNode(Token token, ExprNode operand) {
        this.token = Objects.requireNonNull(token, "token");
        this.operand = Objects.requireNonNull(operand, "operand");
        adopt(List.of(operand));
    }

    public ExprNode operand() {
        return operand;
    }

    @Override
    public Token token() {
        return token;
    }

    @Override
    public List<ExprNode> children() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitNotOp(this);
    }

    @Override
    public String type() {
        return "NotOp";
    }

    @Override
    public String toString() {
        return "NotOp[operand=" + operand + "]";
    }
}
