package it.polimi.ds.ruleir.ir;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonRuleSerdeTest {

    static final JacksonRuleSerde SERDE = new JacksonRuleSerde();

    @Test
    void itemCheckWithoutCount() {
        var node = new ItemCheckNode(new ConstantNode("Power Glove"));
        var json = SERDE.jsonify(node);
        assertEquals("{\"type\":\"item_check\",\"item\":{\"type\":\"constant\",\"value\":\"Power Glove\"}}", json);
        assertEquals(node, SERDE.parseJson(json));
    }

    @Test
    void conditionalWithoutElse() {
        var node = new ConditionalNode(new NameNode("flag"), ConstantNode.TRUE, null);
        var json = SERDE.jsonify(node);
        assertTrue(json.contains("\"if_false\":null"), json);
        assertEquals(node, SERDE.parseJson(json));
    }

    @Test
    void nestedNodes() {
        var node = new AndNode(List.of(
                new OrNode(List.of(
                        new ItemCheckNode(new ConstantNode("Hookshot"), ConstantNode.ONE),
                        new GroupCheckNode(new ConstantNode("Swords")))),
                new NotNode(new HelperNode("can_fly", List.of(new ConstantNode(2)))),
                new CompareNode(
                        new StateMethodNode("count", List.of(new ConstantNode("Arrow"))),
                        ">=",
                        new BinaryOpNode(new ConstantNode(5), "*", new NameNode("n"))),
                new CountCheckNode(new ConstantNode("Small Key"), new ConstantNode(3)),
                new AllOfNode(
                        new FunctionCallNode(new NameNode("f"), List.of(new NameNode("x"))),
                        new ComprehensionDetailsNode(new NameNode("f"), new NameNode("rules"))),
                new SubscriptNode(
                        new AttributeNode(new NameNode("self"), "keys"),
                        new ConstantNode(-1)),
                new GeneratorExpressionNode(
                        new NameNode("x"),
                        new ComprehensionDetailsNode(new NameNode("x"), new ListNode(List.of(ConstantNode.TRUE))))));

        assertEquals(node, SERDE.parseJson(SERDE.jsonify(node)));
    }

    @Test
    void constantValues() {
        var map = new LinkedHashMap<String, Object>();
        map.put("a", 1);
        map.put("b", null);
        var node = new ConstantNode(List.of(
                1, 3_000_000_000L, new BigInteger("100000000000000000000"), 2.5, "s", true, map));

        assertEquals(node, SERDE.parseJson(SERDE.jsonify(node)));
        assertEquals("{\"type\":\"constant\",\"value\":null}", SERDE.jsonify(new ConstantNode(null)));
    }

    @Test
    void errorNode() {
        var node = new ErrorNode(
                "Errors while lowering rule",
                ErrorSubtype.VISITATION,
                List.of("Lowering function rule"),
                List.of(new ErrorLogEntry("Unsupported dict at line 1"), new ErrorLogEntry("Boom", "trace")));
        var json = SERDE.jsonify(node);

        assertTrue(json.contains("\"subtype\":\"visitation\""), json);
        assertTrue(json.contains("\"error_log\":[{\"message\":\"Unsupported dict at line 1\",\"trace\":null}"), json);
        assertFalse(json.contains("cleaned_source"), json);
        assertFalse(json.contains("traceback"), json);
        assertEquals(node, SERDE.parseJson(json));

        var parseError = new ErrorNode("bad", ErrorSubtype.AST_PARSE, List.of(), List.of(), "def f(:", null);
        assertEquals(parseError, SERDE.parseJson(SERDE.jsonify(parseError)));
    }

    @Test
    void indentedOutput() {
        var json = new JacksonRuleSerde(true).jsonify(new NameNode("x"));
        assertTrue(json.contains("\n"), json);
        assertEquals(new NameNode("x"), SERDE.parseJson(json));
    }

    @Test
    void invalidJson() {
        assertThrows(UncheckedIOException.class, () -> SERDE.parseJson("{\"type\":\"nope\"}"));
        assertThrows(UncheckedIOException.class, () -> SERDE.parseJson("{\"type\":\"not\"}"));
        assertThrows(UncheckedIOException.class, () -> SERDE.parseJson("[]"));
    }

    @Test
    void rejectsNonJsonConstants() {
        assertThrows(IllegalArgumentException.class, () -> new ConstantNode(new Object()));
        assertThrows(IllegalArgumentException.class, () -> new ConstantNode(Map.of(1, "a")));
        assertTrue(ConstantNode.isJsonCompatible(Map.of("a", List.of(1, "b"))));
    }
}
