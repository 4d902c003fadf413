package com.exprtree.jackson;

import com.exprtree.ExprTreeWalker;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for ObjectMapper instances that read and write expression trees.
 *
 * <pre>
 * ObjectMapper mapper = ExprTreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(node);
 * ExprNode copy = mapper.readValue(json, ExprNode.class);
 * </pre>
 *
 * The JSON nesting limit follows the expression depth limit of {@link ExprTreeWalker}:
 * one expression level takes at most two JSON levels (a call object and its
 * {@code args} array), plus one for the token object of a leaf.
 */
public final class ExprTreeJackson {

    private static final Logger logger = LoggerFactory.getLogger(ExprTreeJackson.class);

    private ExprTreeJackson() {
        // Utility class
    }

    /**
     * Creates a mapper accepting trees as deep as {@link ExprTreeWalker#DEFAULT_MAX_DEPTH}.
     */
    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(ExprTreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a mapper accepting trees up to {@code maxExprDepth} expression levels.
     */
    public static ObjectMapper createObjectMapper(int maxExprDepth) {
        if (maxExprDepth < 1) {
            throw new IllegalArgumentException("maxExprDepth must be positive but was " + maxExprDepth);
        }
        int maxNesting = jsonNestingFor(maxExprDepth);
        JsonFactory factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(maxNesting).build())
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(maxNesting).build())
            .build();

        ObjectMapper mapper = new ObjectMapper(factory);
        // Nodes have no optional properties; this only drops nulls inside Token.
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // Trees exported by other tools may carry extra properties such as source ranges.
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new ExprModule());

        logger.debug("Created ObjectMapper for expressions up to {} levels (JSON nesting {})",
            maxExprDepth, maxNesting);
        return mapper;
    }

    static int jsonNestingFor(int maxExprDepth) {
        return 2 * maxExprDepth + 1;
    }
}
