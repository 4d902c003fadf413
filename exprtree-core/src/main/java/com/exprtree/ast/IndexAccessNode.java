package com.exprtree.ast;

import com.exprtree.Token;

import java.util.List;
import java.util.Objects;

/**
 * Index access like {@code foo[bar]}, a dynamic object property access or an
 * array element access.
 */
public final class IndexAccessNode extends ExprNodeBase implements ExprNode {
    private final ExprNode operand;
    private final ExprNode index;

    /**
     * @param operand expression being indexed, which should be an array or an object
     * @param index   expression inside the brackets, which should be an integer or a string
     */
    public IndexAccessNode(ExprNode operand, ExprNode index) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.index = Objects.requireNonNull(index, "index");
        adopt(List.of(operand, index));
    }

    public ExprNode operand() {
        return operand;
    }

    public ExprNode index() {
        return index;
    }

    @Override
    public Token token() {
        return operand.token();
    }

    @Override
    public List<ExprNode> children() {
        return List.of(operand, index);
    }

    @Override
    public <R> R accept(ExprNodeVisitor<R> visitor) {
        return visitor.visitIndexAccess(this);
    }

    @Override
    public String type() {
        return "IndexAccess";
    }

    @Override
    public String toString() {
        return "IndexAccess[operand=" + operand + ", index=" + index + "]";
    }
}
