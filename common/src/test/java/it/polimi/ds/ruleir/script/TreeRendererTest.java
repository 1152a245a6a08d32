package it.polimi.ds.ruleir.script;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TreeRendererTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "lambda state: state.has('Lamp', player) and state.has('Hammer', player)",
            "lambda state, player=1: can_lift_rocks(state, player)",
            "(a or b) and c",
            "a or b and c",
            "not (a and b)",
            "a - (b - c)",
            "a - b - c",
            "x if a else y",
            "all(f(state) for f in rules)",
            "[x for x in y if x]",
            "(1,)",
            "{'a': 1}",
            "items[-1]",
            "state.count('Arrow', player) >= 10",
            "x not in ['a', 'b']",
    })
    void rendersCanonicalSourceUnchanged(String source) throws ScriptSyntaxException {
        assertEquals(source, TreeRenderer.render(ScriptParser.parseExpression(source)));
    }

    @Test
    void normalizesSpacing() throws ScriptSyntaxException {
        assertEquals("state.has(\"Sword\", player)",
                TreeRenderer.render(ScriptParser.parseExpression("state.has( \"Sword\" ,player )"))
                        .replace('\'', '"'));
        assertEquals("lambda state: a and b",
                TreeRenderer.render(ScriptParser.parseExpression("lambda state:(a\n and b)")));
    }

    @Test
    void literals() {
        assertEquals("None", TreeRenderer.literal(null));
        assertEquals("True", TreeRenderer.literal(true));
        assertEquals("1.0", TreeRenderer.literal(1.0));
        assertEquals("-3", TreeRenderer.literal(-3));
        assertEquals("100000000000000000000", TreeRenderer.literal(new BigInteger("100000000000000000000")));
        assertEquals("'plain'", TreeRenderer.literal("plain"));
        assertEquals("\"it's\"", TreeRenderer.literal("it's"));
        assertEquals("'a\\nb'", TreeRenderer.literal("a\nb"));
    }
}
