package com.exprtree.jackson;

import com.exprtree.ast.*;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes an expression tree as nested JSON objects.
 *
 * <pre>
 * {"type":"ObjectDeref","receiver":{"type":"Variable","token":{...},"name":"foo"},"property":"bar"}
 * </pre>
 *
 * Nodes which take their position from a child have no "token" property.
 */
public class ExprNodeSerializer extends StdSerializer<ExprNode> {

    public ExprNodeSerializer() {
        super(ExprNode.class);
    }

    @Override
    public void serialize(ExprNode node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", node.type());
        try {
            node.accept(new FieldWriter(gen, provider));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        gen.writeEndObject();
    }

    @FunctionalInterface
    private interface Fields {
        void write() throws IOException;
    }

    private final class FieldWriter implements ExprNodeVisitor<Void> {
        private final JsonGenerator gen;
        private final SerializerProvider provider;

        FieldWriter(JsonGenerator gen, SerializerProvider provider) {
            this.gen = gen;
            this.provider = provider;
        }

        private Void write(Fields fields) {
            try {
                fields.write();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        private void token(ExprNode node) throws IOException {
            provider.defaultSerializeField("token", node.token(), gen);
        }

        private void child(String name, ExprNode child) throws IOException {
            gen.writeFieldName(name);
            serialize(child, gen, provider);
        }

        @Override
        public Void visitVariable(VariableNode node) {
            return write(() -> {
                token(node);
                gen.writeStringField("name", node.name());
            });
        }

        @Override
        public Void visitNull(NullNode node) {
            return write(() -> token(node));
        }

        @Override
        public Void visitBool(BoolNode node) {
            return write(() -> {
                token(node);
                gen.writeBooleanField("value", node.value());
            });
        }

        @Override
        public Void visitInt(IntNode node) {
            return write(() -> {
                token(node);
                gen.writeNumberField("value", node.value());
            });
        }

        @Override
        public Void visitFloat(FloatNode node) {
            return write(() -> {
                token(node);
                gen.writeFieldName("value");
                ExprNumberSerializer.writeFloat(gen, node.value());
            });
        }

        @Override
        public Void visitString(StringNode node) {
            return write(() -> {
                token(node);
                gen.writeStringField("value", node.value());
            });
        }

        @Override
        public Void visitObjectDeref(ObjectDerefNode node) {
            return write(() -> {
                child("receiver", node.receiver());
                gen.writeStringField("property", node.property());
            });
        }

        @Override
        public Void visitArrayDeref(ArrayDerefNode node) {
            return write(() -> child("receiver", node.receiver()));
        }

        @Override
        public Void visitIndexAccess(IndexAccessNode node) {
            return write(() -> {
                child("operand", node.operand());
                child("index", node.index());
            });
        }

        @Override
        public Void visitNotOp(NotOpNode node) {
            return write(() -> {
                token(node);
                child("operand", node.operand());
            });
        }

        @Override
        public Void visitCompareOp(CompareOpNode node) {
            return write(() -> {
                gen.writeStringField("kind", node.kind().symbol());
                child("left", node.left());
                child("right", node.right());
            });
        }

        @Override
        public Void visitLogicalOp(LogicalOpNode node) {
            return write(() -> {
                gen.writeStringField("kind", node.kind().symbol());
                child("left", node.left());
                child("right", node.right());
            });
        }

        @Override
        public Void visitFuncCall(FuncCallNode node) {
            return write(() -> {
                token(node);
                gen.writeStringField("callee", node.callee());
                gen.writeArrayFieldStart("args");
                for (ExprNode arg : node.args()) {
                    serialize(arg, gen, provider);
                }
                gen.writeEndArray();
            });
        }
    }
}
