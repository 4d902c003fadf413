package com.exprtree.jackson;

import com.exprtree.Token;
import com.exprtree.ast.ExprNode;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that configures serialization/deserialization for expression trees.
 *
 * This module handles:
 * - Node serialization through {@link ExprNodeSerializer}
 * - Node deserialization, with parent links, through {@link ExprNodeDeserializer}
 * - A stable property order for tokens
 */
public class ExprModule extends SimpleModule {

    /**
     * Id under which the module shows up in {@code ObjectMapper.getRegisteredModuleIds()}.
     */
    public static final String TYPE_ID = "com.exprtree.jackson.ExprModule";

    public ExprModule() {
        super("ExprModule", new Version(1, 0, 0, null, "com.exprtree", "exprtree-jackson"));
        addSerializer(ExprNode.class, new ExprNodeSerializer());
        addDeserializer(ExprNode.class, new ExprNodeDeserializer());
    }

    @Override
    public Object getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(Token.class, TokenMixin.class);
    }

    @JsonPropertyOrder({"type", "lexeme", "offset", "line", "column"})
    private abstract static class TokenMixin {
    }
}
