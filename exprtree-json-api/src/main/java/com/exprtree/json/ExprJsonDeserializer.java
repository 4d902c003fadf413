package com.exprtree.json;

import com.exprtree.ast.ExprNode;

/**
 * Interface for reading expression trees back from JSON.
 */
public interface ExprJsonDeserializer {

    /**
     * Deserializes a JSON string to a new expression tree with its parent links set.
     *
     * @param json the JSON string to deserialize
     * @return the root of the tree
     * @throws ExprJsonException if the JSON is malformed or does not describe an expression tree
     */
    ExprNode deserialize(String json) throws ExprJsonException;

    /**
     * Deserializes a JSON string whose root must be of the given node variant.
     *
     * @param json the JSON string to deserialize
     * @param type the expected variant of the root
     * @param <T> the node type
     * @return the root of the tree
     * @throws ExprJsonException if deserialization fails or the root has another variant
     */
    <T extends ExprNode> T deserialize(String json, Class<T> type) throws ExprJsonException;
}
