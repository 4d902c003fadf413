package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Function call like {@code contains(github.event.issue.labels.*.name, 'bug')}.
 * Only built-in functions can be called, so the callee is a plain name.
 */
public final class FuncCallNode extends ExprNodeBase implements ExprNode {
    private final Token token;
    private final String callee;
    private final List<ExprNode> args;

    public FuncCallNode(Token token, String callee, List<? extends ExprNode> args) {
        this.token = Objects.requireNonNull(token, "token");
        this.callee = Objects.requireNonNull(callee, "callee");
        this.args = List.copyOf(args);
        adopt(this.args);
    }

    public String callee() {
        return callee;
    }

    public List<ExprNode> args() {
        return args;
    }

    @Override
    public Token token() {
        return token;
    }

    @Override
    public List<ExprNode> children() {
        return args;
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitFuncCall(this);
    }

    @Override
    public String type() {
        return "FuncCall";
    }

    @Override
    public String toString() {
        return "FuncCall[" + callee + args + "]";
    }
}
