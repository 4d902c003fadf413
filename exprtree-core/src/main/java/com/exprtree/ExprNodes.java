package com.exprtree;

import com.exprtree.ast.ExprNode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Entry points for analyzers reading expression trees.
 */
public final class ExprNodes {

    private ExprNodes() {
        // Utility class
    }

    /**
     * Visits the tree rooted at {@code root} with the default walker.
     *
     * @see ExprTreeWalker
     */
    public static void visit(ExprNode root, VisitExprNodeFunc func) {
        ExprTreeWalker.defaultWalker().walk(root, func);
    }

    /**
     * Counts the nodes of the tree rooted at {@code root}.
     */
    public static int size(ExprNode root) {
        int[] count = {0};
        visit(root, (node, parent, entering) -> {
            if (entering) {
                count[0]++;
            }
        });
        return count[0];
    }

    /**
     * Applies {@code predicate} to each ancestor of {@code node}, nearest first,
     * and returns the first non-empty result. {@code node} itself is not tested.
     *
     * @return the result for the nearest matching ancestor, or empty when none matches
     */
    public static <T> Optional<T> findParent(ExprNode node, Function<? super ExprNode, Optional<T>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        for (ExprNode p = node.parent(); p != null; p = p.parent()) {
            Optional<T> found = predicate.apply(p);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the nearest ancestor of {@code node} of the given variant.
     */
    public static <T extends ExprNode> Optional<T> findParent(ExprNode node, Class<T> type) {
        return findParent(node, type, t -> true);
    }

    /**
     * Returns the nearest ancestor of {@code node} of the given variant that also satisfies {@code test}.
     */
    public static <T extends ExprNode> Optional<T> findParent(ExprNode node, Class<T> type, Predicate<? super T> test) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(test, "test");
        return findParent(node, p -> {
            if (type.isInstance(p)) {
                T t = type.cast(p);
                if (test.test(t)) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Follows parent links from {@code node} up to the root of its tree.
     */
    public static ExprNode root(ExprNode node) {
        ExprNode current = Objects.requireNonNull(node, "node");
        while (current.parent() != null) {
            current = current.parent();
        }
        return current;
    }
}
