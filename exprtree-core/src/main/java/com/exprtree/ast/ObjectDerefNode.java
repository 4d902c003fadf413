package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Property dereference of an object like {@code foo.bar}.
 */
public final class ObjectDerefNode extends ExprNodeBase implements ExprNode {
    private final ExprNode receiver;
    private final String property;

    public ObjectDerefNode(ExprNode receiver, String property) {
        this.property = Objects.requireNonNull(property, "property");
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        adopt(List.of(receiver));
    }

    public ExprNode receiver() {
        return receiver;
    }

    public String property() {
        return property;
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
        return visitor.visitObjectDeref(this);
    }

    @Override
    public String type() {
        return "ObjectDeref";
    }

    @Override
    public String toString() {
        return "ObjectDeref[receiver=" + receiver + ", property=" + property + "]";
    }
}
