package com.exprtree.jackson;

import com.exprtree.ExprNodes;
import com.exprtree.Token;
import com.exprtree.TokenType;
import com.exprtree.ast.*;
import com.exprtree.json.ExprJsonException;
import com.exprtree.json.ExprJsonProvider;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonExprJsonProviderTest {

    private final JacksonExprJsonProvider provider = new JacksonExprJsonProvider();

    private static Token tok(TokenType type, String lexeme, int column) {
        return new Token(type, lexeme, column - 1, 1, column);
    }

    private static VariableNode variable(String name, int column) {
        return new VariableNode(tok(TokenType.IDENT, name, column), name);
    }

    // contains(github.event.labels.*.name, 'bug') || !(matrix['os'] >= 2.0)
    private static LogicalOpNode sample() {
        ObjectDerefNode names = new ObjectDerefNode(
            new ArrayDerefNode(new ObjectDerefNode(new ObjectDerefNode(variable("github", 10), "event"), "labels")),
            "name");
        StringNode bug = new StringNode(tok(TokenType.STRING, "'bug'", 38), "bug");
        FuncCallNode contains = new FuncCallNode(tok(TokenType.IDENT, "contains", 1), "contains", List.of(names, bug));

        IndexAccessNode os = new IndexAccessNode(variable("matrix", 50),
            new StringNode(tok(TokenType.STRING, "'os'", 57), "os"));
        CompareOpNode ge = new CompareOpNode(CompareOpNodeKind.GREATER_EQ, os,
            new FloatNode(tok(TokenType.FLOAT, "2.0", 65), 2.0));
        NotOpNode not = new NotOpNode(tok(TokenType.NOT, "!", 48), ge);
        return new LogicalOpNode(LogicalOpNodeKind.OR, contains, not);
    }

    private static List<ExprNode> preorder(ExprNode root) {
        List<ExprNode> nodes = new ArrayList<>();
        ExprNodes.visit(root, (node, parent, entering) -> {
            if (entering) {
                nodes.add(node);
            }
        });
        return nodes;
    }

    @Test
    void testSerializeLeaf() {
        String json = provider.getSerializer().serialize(variable("env", 1));
        assertEquals("{\"type\":\"Variable\","
            + "\"token\":{\"type\":\"IDENT\",\"lexeme\":\"env\",\"offset\":0,\"line\":1,\"column\":1},"
            + "\"name\":\"env\"}", json);
    }

    @Test
    void testSerializeIndexAccess() throws Exception {
        IndexAccessNode root = new IndexAccessNode(
            new ObjectDerefNode(variable("foo", 1), "bar"),
            new ObjectDerefNode(variable("baz", 9), "qux"));

        ObjectMapper mapper = provider.getObjectMapper();
        JsonNode actual = mapper.readTree(provider.getSerializer().serialize(root));
        JsonNode expected = mapper.readTree("""
            {
              "type": "IndexAccess",
              "operand": {
                "type": "ObjectDeref",
                "receiver": {
                  "type": "Variable",
                  "token": { "type": "IDENT", "lexeme": "foo", "offset": 0, "line": 1, "column": 1 },
                  "name": "foo"
                },
                "property": "bar"
              },
              "index": {
                "type": "ObjectDeref",
                "receiver": {
                  "type": "Variable",
                  "token": { "type": "IDENT", "lexeme": "baz", "offset": 8, "line": 1, "column": 9 },
                  "name": "baz"
                },
                "property": "qux"
              }
            }
            """);
        assertEquals(expected, actual);
    }

    @Test
    void testParentLinksAreNotWritten() {
        String json = provider.getSerializer().serializePretty(sample());
        assertFalse(json.contains("\"parent\""), json);
        assertTrue(json.contains("\"kind\" : \"||\""), json);
        assertTrue(json.contains("\"kind\" : \">=\""), json);
    }

    @Test
    void testIntegralFloatWrittenWithoutDecimalPoint() throws Exception {
        FloatNode two = new FloatNode(tok(TokenType.FLOAT, "2.0", 1), 2.0);
        JsonNode json = provider.getObjectMapper().readTree(provider.getSerializer().serialize(two));
        assertTrue(json.get("value").isIntegralNumber());
        assertEquals(2, json.get("value").asInt());

        FloatNode back = provider.getDeserializer().deserialize(json.toString(), FloatNode.class);
        assertEquals(2.0, back.value());
    }

    @Test
    void testLargeIntegralFloatWrittenInFull() throws Exception {
        FloatNode big = new FloatNode(tok(TokenType.FLOAT, "1e20", 1), 1e20);
        String json = provider.getSerializer().serialize(big);
        assertTrue(json.contains("\"value\":100000000000000000000"), json);
        assertEquals(1e20, provider.getDeserializer().deserialize(json, FloatNode.class).value());

        FloatNode huge = new FloatNode(tok(TokenType.FLOAT, "1e21", 1), 1e21);
        JsonNode value = provider.getObjectMapper().readTree(provider.getSerializer().serialize(huge)).get("value");
        assertTrue(value.isFloatingPointNumber(), value.toString());
        assertEquals(1e21, value.asDouble());
    }

    @Test
    void testNonFiniteFloats() {
        for (double d : new double[] {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 0.25}) {
            String json = provider.getSerializer().serialize(new FloatNode(tok(TokenType.FLOAT, "x", 1), d));
            FloatNode back = provider.getDeserializer().deserialize(json, FloatNode.class);
            assertEquals(Double.valueOf(d), Double.valueOf(back.value()), json);
        }
    }

    @Test
    void testReadBackKeepsShapeAndTokens() {
        LogicalOpNode original = sample();
        String json = provider.getSerializer().serialize(original);
        ExprNode copy = provider.getDeserializer().deserialize(json);

        List<ExprNode> expected = preorder(original);
        List<ExprNode> actual = preorder(copy);
        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i).toString(), actual.get(i).toString());
            assertEquals(expected.get(i).token(), actual.get(i).token());
        }
        assertEquals(json, provider.getSerializer().serialize(copy));
    }

    @Test
    void testReadBackRebuildsParentLinks() {
        ExprNode copy = provider.getDeserializer().deserialize(provider.getSerializer().serialize(sample()));

        assertNull(copy.parent());
        ExprNodes.visit(copy, (node, parent, entering) -> assertSame(parent, node.parent()));

        LogicalOpNode or = (LogicalOpNode) copy;
        FuncCallNode contains = (FuncCallNode) or.left();
        ExprNode github = ((ObjectDerefNode) ((ObjectDerefNode) ((ArrayDerefNode)
            ((ObjectDerefNode) contains.args().get(0)).receiver()).receiver()).receiver()).receiver();
        assertEquals("github", github.token().lexeme());
        assertSame(contains, ExprNodes.findParent(github, FuncCallNode.class).orElseThrow());
        assertSame(or, ExprNodes.root(github));
    }

    @Test
    void testUnknownNodeType() {
        String json = "{\"type\":\"Ternary\"}";
        ExprJsonException e = assertThrows(ExprJsonException.class,
            () -> provider.getDeserializer().deserialize(json));
        assertInstanceOf(JsonMappingException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("unknown expression node type 'Ternary'"),
            e.getCause().getMessage());
    }

    @Test
    void testMissingChild() {
        String json = "{\"type\":\"ArrayDeref\"}";
        ExprJsonException e = assertThrows(ExprJsonException.class,
            () -> provider.getDeserializer().deserialize(json));
        assertTrue(e.getCause().getMessage().contains("missing 'receiver' at $"), e.getCause().getMessage());
    }

    @Test
    void testUnknownOperator() {
        String json = "{\"type\":\"LogicalOp\",\"kind\":\"??\","
            + "\"left\":{\"type\":\"Null\",\"token\":{\"type\":\"IDENT\",\"lexeme\":\"null\",\"offset\":0,\"line\":1,\"column\":1}},"
            + "\"right\":{\"type\":\"Null\",\"token\":{\"type\":\"IDENT\",\"lexeme\":\"null\",\"offset\":8,\"line\":1,\"column\":9}}}";
        ExprJsonException e = assertThrows(ExprJsonException.class,
            () -> provider.getDeserializer().deserialize(json));
        assertTrue(e.getCause().getMessage().contains("unknown logical operator '??'"), e.getCause().getMessage());
    }

    @Test
    void testInvalidTokenPosition() {
        String json = "{\"type\":\"Variable\",\"name\":\"a\","
            + "\"token\":{\"type\":\"IDENT\",\"lexeme\":\"a\",\"offset\":0,\"line\":0,\"column\":1}}";
        assertThrows(ExprJsonException.class, () -> provider.getDeserializer().deserialize(json));
    }

    @Test
    void testNestedErrorReportsPath() {
        String json = "{\"type\":\"FuncCall\",\"callee\":\"f\","
            + "\"token\":{\"type\":\"IDENT\",\"lexeme\":\"f\",\"offset\":0,\"line\":1,\"column\":1},"
            + "\"args\":[{\"type\":\"Bool\",\"token\":{\"type\":\"IDENT\",\"lexeme\":\"true\",\"offset\":2,\"line\":1,\"column\":3},\"value\":\"yes\"}]}";
        ExprJsonException e = assertThrows(ExprJsonException.class,
            () -> provider.getDeserializer().deserialize(json));
        assertTrue(e.getCause().getMessage().contains("'value' must be a boolean at $.args[0]"),
            e.getCause().getMessage());
    }

    @Test
    void testWrongRootType() {
        String json = provider.getSerializer().serialize(new ObjectDerefNode(variable("a", 1), "b"));
        ExprJsonException e = assertThrows(ExprJsonException.class,
            () -> provider.getDeserializer().deserialize(json, VariableNode.class));
        assertTrue(e.getMessage().contains("ObjectDeref"), e.getMessage());
        assertNotNull(provider.getDeserializer().deserialize(json, ObjectDerefNode.class));
    }

    @Test
    void testMalformedJson() {
        assertThrows(ExprJsonException.class, () -> provider.getDeserializer().deserialize("{\"type\":"));
        assertThrows(ExprJsonException.class, () -> provider.getDeserializer().deserialize("null"));
        assertThrows(ExprJsonException.class, () -> provider.getDeserializer().deserialize("[1, 2]"));
    }

    @Test
    void testDiscoveredThroughServiceLoader() {
        assertTrue(ExprJsonProvider.isProviderAvailable());
        ExprJsonProvider found = ExprJsonProvider.getProvider("jackson");
        assertInstanceOf(JacksonExprJsonProvider.class, found);
        assertEquals("Jackson", ExprJsonProvider.getProvider().getName());
    }

    @Test
    void testDeepTreeWithinWalkerLimitRoundTrips() {
        ExprNode node = variable("x", 1);
        for (int i = 0; i < 520; i++) {
            node = new FuncCallNode(tok(TokenType.IDENT, "f", 1), "f", List.of(node));
        }
        String json = provider.getSerializer().serialize(node);
        ExprNode copy = provider.getDeserializer().deserialize(json);
        assertEquals(521, ExprNodes.size(copy));
    }

    @Test
    void testMapperRejectsTreesDeeperThanConfigured() {
        ExprNode node = variable("x", 5);
        for (int i = 4; i >= 1; i--) {
            node = new NotOpNode(tok(TokenType.NOT, "!", i), node);
        }
        ExprNode deep = node;
        String json = provider.getSerializer().serialize(deep);
        JacksonExprJsonProvider shallow = new JacksonExprJsonProvider(ExprTreeJackson.createObjectMapper(2));

        assertThrows(ExprJsonException.class, () -> shallow.getDeserializer().deserialize(json));
        ExprJsonException e = assertThrows(ExprJsonException.class, () -> shallow.getSerializer().serialize(deep));
        assertTrue(e.getMessage().contains("NotOp node at"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ExprTreeJackson.createObjectMapper(0));
    }

    @Test
    void testMapperMustCarryExprModule() {
        assertThrows(NullPointerException.class, () -> new JacksonExprJsonProvider(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new JacksonExprJsonProvider(new ObjectMapper()));
        assertTrue(e.getMessage().contains("ExprModule"), e.getMessage());

        ObjectMapper custom = new ObjectMapper().registerModule(new ExprModule());
        String json = new JacksonExprJsonProvider(custom).getSerializer().serialize(variable("a", 1));
        assertTrue(json.startsWith("{\"type\":\"Variable\""), json);
    }
}
