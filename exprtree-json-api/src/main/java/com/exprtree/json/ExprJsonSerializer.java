package com.exprtree.json;

import com.exprtree.ast.ExprNode;

/**
 * Interface for serializing expression trees to JSON.
 */
public interface ExprJsonSerializer {

    /**
     * Serializes the tree rooted at {@code node} to a JSON string. Parent links
     * are not written; they follow from the nesting.
     *
     * @param node the root of the tree to serialize
     * @return the JSON representation of the tree
     * @throws ExprJsonException if serialization fails
     */
    String serialize(ExprNode node) throws ExprJsonException;

    /**
     * Same as {@link #serialize(ExprNode)} but pretty-printed.
     */
    String serializePretty(ExprNode node) throws ExprJsonException;
}
