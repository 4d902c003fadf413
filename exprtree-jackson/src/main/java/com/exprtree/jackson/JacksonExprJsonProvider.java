package com.exprtree.jackson;

import com.exprtree.ast.ExprNode;
import com.exprtree.json.ExprJsonDeserializer;
import com.exprtree.json.ExprJsonException;
import com.exprtree.json.ExprJsonProvider;
import com.exprtree.json.ExprJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Objects;

/**
 * Jackson-based ExprJsonProvider. One instance is both the serializer and the
 * deserializer; readers and writers are prepared once and shared between threads.
 */
public class JacksonExprJsonProvider implements ExprJsonProvider, ExprJsonSerializer, ExprJsonDeserializer {

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final ObjectWriter prettyWriter;
    private final ObjectReader reader;

    public JacksonExprJsonProvider() {
        this(ExprTreeJackson.createObjectMapper());
    }

    /**
     * @param mapper mapper with {@link ExprModule} registered, e.g. from {@link ExprTreeJackson}
     * @throws IllegalArgumentException if the mapper does not have {@link ExprModule}
     */
    public JacksonExprJsonProvider(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!mapper.getRegisteredModuleIds().contains(ExprModule.TYPE_ID)) {
            throw new IllegalArgumentException(
                "ObjectMapper has no ExprModule registered; use ExprTreeJackson.createObjectMapper()");
        }
        this.mapper = mapper;
        this.writer = mapper.writerFor(ExprNode.class);
        this.prettyWriter = writer.withDefaultPrettyPrinter();
        this.reader = mapper.readerFor(ExprNode.class);
    }

    @Override
    public ExprJsonSerializer getSerializer() {
        return this;
    }

    @Override
    public ExprJsonDeserializer getDeserializer() {
        return this;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    @Override
    public String serialize(ExprNode node) throws ExprJsonException {
        return write(writer, node);
    }

    @Override
    public String serializePretty(ExprNode node) throws ExprJsonException {
        return write(prettyWriter, node);
    }

    private static String write(ObjectWriter writer, ExprNode node) {
        Objects.requireNonNull(node, "node");
        try {
            return writer.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ExprJsonException("Failed to serialize " + node.type() + " node at " + node.token(), e);
        }
    }

    @Override
    public ExprNode deserialize(String json) throws ExprJsonException {
        return deserialize(json, ExprNode.class);
    }

    @Override
    public <T extends ExprNode> T deserialize(String json, Class<T> type) throws ExprJsonException {
        Objects.requireNonNull(json, "json");
        ExprNode node;
        try {
            node = reader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new ExprJsonException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
        if (node == null) {
            throw new ExprJsonException("Failed to read " + type.getSimpleName() + " from JSON: document is null");
        }
        if (!type.isInstance(node)) {
            throw new ExprJsonException(
                "Expected " + type.getSimpleName() + " but JSON describes a " + node.type() + " node");
        }
        return type.cast(node);
    }
}
