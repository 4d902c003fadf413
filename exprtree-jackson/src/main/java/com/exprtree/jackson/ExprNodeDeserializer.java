package com.exprtree.jackson;

import com.exprtree.Token;
import com.exprtree.ast.*;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON written by {@link ExprNodeSerializer}. Nodes are created
 * children first through their public constructors, so the parent links of
 * the result are set exactly as a parser would set them.
 */
public class ExprNodeDeserializer extends StdDeserializer<ExprNode> {

    public ExprNodeDeserializer() {
        super(ExprNode.class);
    }

    @Override
    public ExprNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = ctxt.readTree(p);
        return build(tree, "$", ctxt);
    }

    private ExprNode build(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        if (json == null || !json.isObject()) {
            throw mismatch(ctxt, path, "expected an expression node object but got "
                + (json == null ? "nothing" : json.getNodeType()));
        }
        String type = text(json, "type", path, ctxt);
        return switch (type) {
            case "Variable" -> new VariableNode(token(json, path, ctxt), text(json, "name", path, ctxt));
            case "Null" -> new NullNode(token(json, path, ctxt));
            case "Bool" -> new BoolNode(token(json, path, ctxt), bool(json, path, ctxt));
            case "Int" -> new IntNode(token(json, path, ctxt), integer(json, path, ctxt));
            case "Float" -> new FloatNode(token(json, path, ctxt), floating(json, path, ctxt));
            case "String" -> new StringNode(token(json, path, ctxt), text(json, "value", path, ctxt));
            case "ObjectDeref" -> new ObjectDerefNode(
                child(json, "receiver", path, ctxt),
                text(json, "property", path, ctxt));
            case "ArrayDeref" -> new ArrayDerefNode(child(json, "receiver", path, ctxt));
            case "IndexAccess" -> new IndexAccessNode(
                child(json, "operand", path, ctxt),
                child(json, "index", path, ctxt));
            case "NotOp" -> new NotOpNode(token(json, path, ctxt), child(json, "operand", path, ctxt));
            case "CompareOp" -> {
                String symbol = text(json, "kind", path, ctxt);
                CompareOpNodeKind kind = CompareOpNodeKind.fromSymbol(symbol)
                    .orElseThrow(() -> mismatch(ctxt, path, "unknown comparison operator '" + symbol + "'"));
                yield new CompareOpNode(kind, child(json, "left", path, ctxt), child(json, "right", path, ctxt));
            }
            case "LogicalOp" -> {
                String symbol = text(json, "kind", path, ctxt);
                LogicalOpNodeKind kind = LogicalOpNodeKind.fromSymbol(symbol)
                    .orElseThrow(() -> mismatch(ctxt, path, "unknown logical operator '" + symbol + "'"));
                yield new LogicalOpNode(kind, child(json, "left", path, ctxt), child(json, "right", path, ctxt));
            }
            case "FuncCall" -> {
                Token token = token(json, path, ctxt);
                String callee = text(json, "callee", path, ctxt);
                yield new FuncCallNode(token, callee, args(json, path, ctxt));
            }
            default -> throw mismatch(ctxt, path, "unknown expression node type '" + type + "'");
        };
    }

    private ExprNode child(JsonNode json, String field, String path, DeserializationContext ctxt) throws IOException {
        return build(required(json, field, path, ctxt), path + "." + field, ctxt);
    }

    private List<ExprNode> args(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        JsonNode array = required(json, "args", path, ctxt);
        if (!array.isArray()) {
            throw mismatch(ctxt, path, "'args' must be an array");
        }
        List<ExprNode> args = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            args.add(build(array.get(i), path + ".args[" + i + "]", ctxt));
        }
        return args;
    }

    private Token token(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        JsonNode token = required(json, "token", path, ctxt);
        return ctxt.readTreeAsValue(token, Token.class);
    }

    private String text(JsonNode json, String field, String path, DeserializationContext ctxt) throws IOException {
        JsonNode value = required(json, field, path, ctxt);
        if (!value.isTextual()) {
            throw mismatch(ctxt, path, "'" + field + "' must be a string");
        }
        return value.asText();
    }

    private boolean bool(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        JsonNode value = required(json, "value", path, ctxt);
        if (!value.isBoolean()) {
            throw mismatch(ctxt, path, "'value' must be a boolean");
        }
        return value.asBoolean();
    }

    private long integer(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        JsonNode value = required(json, "value", path, ctxt);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw mismatch(ctxt, path, "'value' must be a 64-bit integer");
        }
        return value.asLong();
    }

    private double floating(JsonNode json, String path, DeserializationContext ctxt) throws IOException {
        JsonNode value = required(json, "value", path, ctxt);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            switch (value.asText()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw mismatch(ctxt, path, "'value' must be a number");
    }

    private JsonNode required(JsonNode json, String field, String path, DeserializationContext ctxt) throws IOException {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw mismatch(ctxt, path, "missing '" + field + "'");
        }
        return value;
    }

    private static JsonMappingException mismatch(DeserializationContext ctxt, String path, String message) {
        return JsonMappingException.from(ctxt, message + " at " + path);
    }
}
