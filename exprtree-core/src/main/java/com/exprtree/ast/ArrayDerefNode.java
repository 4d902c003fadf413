package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Element dereference of an array, the {@code *} in {@code foo.bar.*.piyo}.
 */
public final class ArrayDerefNode extends ExprNodeBase implements ExprNode {
    private final ExprNode receiver;

    public ArrayDerefNode(ExprNode receiver) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        adopt(List.of(receiver));
    }

    public ExprNode receiver() {
        return receiver;
    }

    @Override
    public Token token() {
        return receiver.token();
    }

    @Override
    public List<ExprNode> children() {
        return List.of(receiver);
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitArrayDeref(this);
    }

    @Override
    public String type() {
        return "ArrayDeref";
    }

    @Override
    public String toString() {
        return "ArrayDeref[receiver=" + receiver + "]";
    }
}
