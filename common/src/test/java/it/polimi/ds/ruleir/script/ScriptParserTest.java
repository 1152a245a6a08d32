package it.polimi.ds.ruleir.script;

import it.polimi.ds.ruleir.tree.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptParserTest {

    @Test
    void boolOpsAndNot() throws ScriptSyntaxException {
        var tree = ScriptParser.parseExpression("state.has('A', player) and not state.has('B', player)");

        var and = assertInstanceOf(BoolOpTree.class, tree);
        assertEquals(BoolOpTree.Operator.AND, and.operator());
        assertEquals(2, and.values().size());

        var call = assertInstanceOf(CallTree.class, and.values().get(0));
        var callee = assertInstanceOf(AttributeTree.class, call.function());
        assertEquals("has", callee.name());
        assertEquals("state", assertInstanceOf(NameTree.class, callee.object()).name());
        assertEquals("A", assertInstanceOf(LiteralTree.class, call.arguments().get(0)).value());

        var not = assertInstanceOf(UnaryTree.class, and.values().get(1));
        assertEquals(UnaryTree.Operator.NOT, not.operator());
    }

    @Test
    void precedence() throws ScriptSyntaxException {
        var or = assertInstanceOf(BoolOpTree.class, ScriptParser.parseExpression("a or b and c"));
        assertEquals(BoolOpTree.Operator.OR, or.operator());
        assertInstanceOf(BoolOpTree.class, or.values().get(1));

        var sum = assertInstanceOf(BinaryTree.class, ScriptParser.parseExpression("1 + 2 * 3"));
        assertEquals(BinaryTree.Operator.ADD, sum.operator());
        assertEquals(BinaryTree.Operator.MULT, assertInstanceOf(BinaryTree.class, sum.right()).operator());
    }

    @Test
    void comparisons() throws ScriptSyntaxException {
        var chained = assertInstanceOf(CompareTree.class, ScriptParser.parseExpression("1 < x <= 3"));
        assertEquals(List.of(CompareTree.Operator.LT, CompareTree.Operator.LT_E), chained.operators());

        var notIn = assertInstanceOf(CompareTree.class, ScriptParser.parseExpression("x not in y"));
        assertEquals(List.of(CompareTree.Operator.NOT_IN), notIn.operators());

        var isNot = assertInstanceOf(CompareTree.class, ScriptParser.parseExpression("x is not None"));
        assertEquals(List.of(CompareTree.Operator.IS_NOT), isNot.operators());
    }

    @Test
    void negativeLiteralsAreFolded() throws ScriptSyntaxException {
        assertEquals(-5, assertInstanceOf(LiteralTree.class, ScriptParser.parseExpression("-5")).value());
        assertEquals(-0.5, assertInstanceOf(LiteralTree.class, ScriptParser.parseExpression("-0.5")).value());

        var pow = assertInstanceOf(UnaryTree.class, ScriptParser.parseExpression("-2 ** 2"));
        assertEquals(UnaryTree.Operator.NEGATE, pow.operator());
    }

    @Test
    void generatorArgument() throws ScriptSyntaxException {
        var call = assertInstanceOf(CallTree.class, ScriptParser.parseExpression("all(f(state) for f in rules)"));
        var gen = assertInstanceOf(ComprehensionExpressionTree.class, call.arguments().get(0));
        assertEquals(ComprehensionExpressionTree.Type.GENERATOR, gen.type());
        assertEquals(1, gen.generators().size());
        assertEquals("rules", assertInstanceOf(NameTree.class, gen.generators().get(0).iterator()).name());
    }

    @Test
    void keywordsAreKeptApart() throws ScriptSyntaxException {
        var call = assertInstanceOf(CallTree.class, ScriptParser.parseExpression("f(a, count=2)"));
        assertEquals(1, call.arguments().size());
        assertEquals(1, call.keywords().size());
        assertEquals("count", call.keywords().get(0).name());
    }

    @Test
    void collections() throws ScriptSyntaxException {
        assertEquals(CollectionLiteralTree.Type.LIST,
                assertInstanceOf(CollectionLiteralTree.class, ScriptParser.parseExpression("[1, 2]")).type());
        assertEquals(CollectionLiteralTree.Type.TUPLE,
                assertInstanceOf(CollectionLiteralTree.class, ScriptParser.parseExpression("(1, 2)")).type());
        assertEquals(CollectionLiteralTree.Type.SET,
                assertInstanceOf(CollectionLiteralTree.class, ScriptParser.parseExpression("{1, 2}")).type());
        assertInstanceOf(DictTree.class, ScriptParser.parseExpression("{'a': 1}"));
    }

    @Test
    void functionDef() throws ScriptSyntaxException {
        var module = ScriptParser.parse("""
                def can_lift_rocks(state, player=1):
                    \"\"\"Docstring\"\"\"
                    return state.has("Power Glove", player)
                """);

        assertEquals(1, module.body().size());
        var def = assertInstanceOf(FunctionDefTree.class, module.body().get(0));
        assertEquals("can_lift_rocks", def.name());
        assertEquals(2, def.parameters().size());
        assertEquals(1, assertInstanceOf(LiteralTree.class, def.parameters().get(1).defaultValue()).value());
        assertEquals(2, def.body().size());
        assertInstanceOf(ReturnTree.class, def.body().get(1));
    }

    @Test
    void ifElif() throws ScriptSyntaxException {
        var module = ScriptParser.parse("""
                if a:
                    x
                elif b:
                    y
                else:
                    z
                """);

        var ifTree = assertInstanceOf(IfTree.class, module.body().get(0));
        var elif = assertInstanceOf(IfTree.class, ifTree.orElse().get(0));
        assertEquals(1, elif.orElse().size());
    }

    @Test
    void wholeRulesFile() throws ScriptSyntaxException {
        var module = ScriptParser.parse("""
                import typing
                from .Items import item_table

                class Rules:
                    pass

                for loc in locations:
                    set_rule(world.get_location(loc, player), lambda state: True)

                set_rule(world.get_location("Cave", player), lambda state: state.has("Lamp", player))
                """);

        assertEquals(5, module.body().size());
        assertInstanceOf(KeywordStatementTree.class, module.body().get(0));
        assertInstanceOf(CompoundStatementTree.class, module.body().get(2));
        var loop = assertInstanceOf(CompoundStatementTree.class, module.body().get(3));
        assertEquals("for", loop.keyword());
        assertEquals(1, loop.body().size());
        assertInstanceOf(ExpressionStatementTree.class, module.body().get(4));
    }

    @Test
    void syntaxErrors() {
        assertThrows(ScriptSyntaxException.class, () -> ScriptParser.parseExpression("a +"));
        assertThrows(ScriptSyntaxException.class, () -> ScriptParser.parseExpression("a b"));
        assertThrows(ScriptSyntaxException.class, () -> ScriptParser.parse("def f(:\n    return 1\n"));
        assertThrows(ScriptSyntaxException.class, () -> ScriptParser.parse("lambda state: "));
    }
}
