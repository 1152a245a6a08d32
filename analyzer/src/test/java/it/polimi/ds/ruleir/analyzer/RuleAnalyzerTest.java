package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.fn.ClosureCell;
import it.polimi.ds.ruleir.analyzer.fn.SourcePredicate;
import it.polimi.ds.ruleir.analyzer.source.SourceLocator;
import it.polimi.ds.ruleir.ir.*;
import it.polimi.ds.ruleir.script.ScriptParser;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleAnalyzerTest {

    static final RuleAnalyzer ANALYZER = new RuleAnalyzer();
    static final JacksonRuleSerde SERDE = new JacksonRuleSerde();

    private static AnalysisResult analyze(String source) {
        return ANALYZER.analyze(SourcePredicate.builder("rule").source(source).parameters("state").build());
    }

    @Test
    void orOfItemChecks() {
        var result = analyze("lambda state: state.has('A', player) or state.has('B', player)");

        assertFalse(result.isError(), result::toString);
        assertEquals(
                "{\"type\":\"or\",\"conditions\":[" +
                        "{\"type\":\"item_check\",\"item\":{\"type\":\"constant\",\"value\":\"A\"}}," +
                        "{\"type\":\"item_check\",\"item\":{\"type\":\"constant\",\"value\":\"B\"}}]}",
                SERDE.jsonify(result.node()));
    }

    @Test
    void andOfItemChecks() {
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: state.has('Hammer', player) and state.has('Moon Pearl', player)")
                .capture("player", 1)
                .build();

        var and = assertInstanceOf(AndNode.class, ANALYZER.analyze(fn).node());
        assertEquals(2, and.conditions().size());
        assertEquals(new ItemCheckNode(new ConstantNode("Hammer")), and.conditions().get(0));
        assertEquals(new ItemCheckNode(new ConstantNode("Moon Pearl")), and.conditions().get(1));
    }

    @Test
    void helpersAreInlined() {
        var helper = SourcePredicate.builder("can_lift_rocks")
                .source("lambda state, player: state.has(\"Power Glove\", player)")
                .parameters("state", "player")
                .build();
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: can_lift_rocks(state, player)")
                .capture("can_lift_rocks", helper)
                .capture("player", 1)
                .build();

        var result = ANALYZER.analyze(fn);
        assertEquals(new ItemCheckNode(new ConstantNode("Power Glove")), result.node());
        assertEquals(
                "{\"type\":\"item_check\",\"item\":{\"type\":\"constant\",\"value\":\"Power Glove\"}}",
                SERDE.jsonify(result.node()));
    }

    @Test
    void callsWithoutStateAreKeptAsHelpers() {
        var helper = SourcePredicate.builder("is_open").source("lambda: True").build();
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: is_open()")
                .capture("is_open", helper)
                .build();

        assertEquals(new HelperNode("is_open", List.of()), ANALYZER.analyze(fn).node());
    }

    @Test
    void failedHelpersAreKeptAsHelpers() {
        var helper = SourcePredicate.builder("broken").source("lambda state: {'a': 1}").build();
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: broken(state, 'Cave')")
                .capture("broken", helper)
                .build();

        var result = ANALYZER.analyze(fn);
        assertEquals(new HelperNode("broken", List.of(new ConstantNode("Cave"))), result.node());
        assertTrue(result.errorLog().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10})
    void selfRecursionStopsAtTheLimit(int limit) {
        var cell = ClosureCell.empty("loop");
        var fn = SourcePredicate.builder("loop")
                .source("lambda state: loop(state)")
                .capture(cell)
                .build();
        cell.set(fn);

        var guard = new RecursionGuard(limit);
        var result = new RuleAnalyzer(Set.of(), new SourceLocator(), limit, 1)
                .analyze(AnalysisRequest.of(fn).withGuard(guard));

        assertEquals(new HelperNode("loop", List.of()), result.node());
        assertTrue(guard.isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10})
    void cycleOfFourHelpersStopsAtTheLimit(int limit) {
        var names = List.of("a", "b", "c", "d");
        var cells = names.stream().map(ClosureCell::empty).toList();

        var helpers = new ArrayList<SourcePredicate>();
        for (int i = 0; i < names.size(); i++) {
            var builder = SourcePredicate.builder(names.get(i))
                    .source("lambda state: " + names.get((i + 1) % names.size()) + "(state)");
            cells.forEach(builder::capture);
            helpers.add(builder.build());
        }
        for (int i = 0; i < names.size(); i++)
            cells.get(i).set(helpers.get(i));

        var guard = new RecursionGuard(limit);
        var result = new RuleAnalyzer(Set.of(), new SourceLocator(), limit, 1)
                .analyze(AnalysisRequest.of(helpers.get(0)).withGuard(guard));

        assertEquals(new HelperNode("a", List.of()), result.node());
        assertTrue(guard.isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10})
    void analysisAtTheLimitIsARecursionError(int limit) {
        var fn = SourcePredicate.builder("rule").source("lambda state: True").build();

        var guard = new RecursionGuard(limit);
        var scopes = new ArrayList<RecursionGuard.Scope>();
        for (int i = 0; i < limit; i++)
            scopes.add(guard.enter(fn));

        var error = assertInstanceOf(ErrorNode.class, ANALYZER.analyze(AnalysisRequest.of(fn).withGuard(guard)).node());
        assertEquals(ErrorSubtype.RECURSION, error.subtype());
        assertEquals(limit, guard.count(fn));

        scopes.forEach(RecursionGuard.Scope::close);
        assertTrue(guard.isEmpty());
    }

    @Test
    void analysisIsIdempotent() {
        var helper = SourcePredicate.builder("has_sword")
                .source("lambda state: state.has_any(['Master Sword', 'Fighter Sword'], player)")
                .build();
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: has_sword(state) and state.count('Arrow', player) >= 10")
                .capture("has_sword", helper)
                .build();

        var first = ANALYZER.analyze(fn);
        analyze("lambda state: state.has('Unrelated', player)");
        var second = ANALYZER.analyze(fn);

        assertFalse(first.isError(), first::toString);
        assertEquals(first.node(), second.node());
        assertEquals(SERDE.jsonify(first.node()), SERDE.jsonify(second.node()));
    }

    @Test
    void folding() {
        var playerList = SourcePredicate.builder("rule")
                .source("lambda state: [player] * 3")
                .capture("player", 2)
                .build();
        assertEquals(
                "{\"type\":\"list\",\"value\":[" +
                        "{\"type\":\"constant\",\"value\":2}," +
                        "{\"type\":\"constant\",\"value\":2}," +
                        "{\"type\":\"constant\",\"value\":2}]}",
                SERDE.jsonify(ANALYZER.analyze(playerList).node()));

        assertEquals("{\"type\":\"constant\",\"value\":3}",
                SERDE.jsonify(analyze("lambda state: len([1, 2, 3])").node()));
        assertEquals("{\"type\":\"constant\",\"value\":[[1,3],[2,4]]}",
                SERDE.jsonify(analyze("lambda state: zip([1, 2], [3, 4])").node()));
    }

    @Test
    void hugeRepetitionsAreKeptAsBinaryOperations() {
        var repeated = assertInstanceOf(BinaryOpNode.class, analyze("lambda state: [1, 2, 3] * 2000000000").node());
        assertEquals(new ConstantNode(2_000_000_000), repeated.right());

        var check = assertInstanceOf(ItemCheckNode.class,
                analyze("lambda state: state.has('A', player, 'x' * 2000000000)").node());
        assertInstanceOf(BinaryOpNode.class, check.count());

        var fn = SourcePredicate.builder("rule")
                .source("lambda state: state.has_all(other * 1000000000, player)")
                .parameters("state")
                .capture("other", List.of("a", "b", "c"))
                .build();
        var method = assertInstanceOf(StateMethodNode.class, ANALYZER.analyze(fn).node());
        assertEquals("has_all", method.method());
        assertInstanceOf(BinaryOpNode.class, method.args().get(0));
    }

    @Test
    void missingElseIsNull() {
        var result = analyze("""
                def rule(state):
                    if cond:
                        return True
                """);

        assertEquals(new ConditionalNode(new NameNode("cond"), ConstantNode.TRUE, null), result.node());
        assertTrue(SERDE.jsonify(result.node()).contains("\"if_false\":null"));
    }

    @Test
    void overridesShadowCaptures() {
        var fn = SourcePredicate.builder("rule")
                .source("lambda state: goal == 'ganon'")
                .capture("goal", "pedestal")
                .build();

        assertEquals(
                new CompareNode(new ConstantNode("ganon"), "==", new ConstantNode("ganon")),
                ANALYZER.analyze(AnalysisRequest.of(fn).withOverrides(Map.of("goal", "ganon"))).node());
    }

    @Test
    void playerContext() {
        var fn = SourcePredicate.builder("rule").source("lambda state: zip([player], [1])").build();

        assertEquals(new ConstantNode(List.of(List.of(1, 1))), ANALYZER.analyze(fn).node());
        assertEquals(new ConstantNode(List.of(List.of(4, 1))),
                ANALYZER.analyze(AnalysisRequest.of(fn).withPlayer(4)).node());
        assertEquals(new ConstantNode(List.of(List.of(7, 1))),
                new RuleAnalyzer(Set.of(), new SourceLocator(), 3, 7).analyze(fn).node());
    }

    @Test
    void preParsedTree() throws ScriptSyntaxException {
        var tree = ScriptParser.parseExpression("state.has('A', player) and flag");
        var request = AnalysisRequest.ofTree(tree).withInherited(Environment.of(Map.of("flag", true)));

        assertEquals(
                new AndNode(List.of(new ItemCheckNode(new ConstantNode("A")), ConstantNode.TRUE)),
                ANALYZER.analyze(request).node());
    }

    @Test
    void nothingToAnalyze() {
        var request = new AnalysisRequest(null, null, Environment.EMPTY, Map.of(), null, GameHandler.NONE, null);
        var error = assertInstanceOf(ErrorNode.class, ANALYZER.analyze(request).node());
        assertEquals(ErrorSubtype.NO_RESULT, error.subtype());
    }

    @Test
    void errorSubtypes() {
        assertEquals(ErrorSubtype.VISITATION, subtype(analyze("lambda state: {'a': 1}")));
        assertEquals(ErrorSubtype.VISITATION, subtype(analyze("lambda state: 1 < x < 3")));
        assertEquals(ErrorSubtype.VISITATION, subtype(analyze("lambda state: can_reach(state, region='Cave')")));
        assertEquals(ErrorSubtype.VISITATION, subtype(analyze("lambda state: -count")));
        assertEquals(ErrorSubtype.SOURCE_CLEANING, subtype(analyze("rule = staticmethod(lambda state: False)")));
        assertEquals(ErrorSubtype.NO_RESULT, subtype(analyze("""
                def rule(state):
                    \"\"\"Only documented\"\"\"
                """)));

        var noSource = SourcePredicate.builder("rule").file(Path.of("does-not-exist.py"), 3).build();
        assertEquals(ErrorSubtype.SOURCE_CLEANING, subtype(ANALYZER.analyze(noSource)));
    }

    @Test
    void parseErrorsKeepTheCleanedSource() {
        var error = assertInstanceOf(ErrorNode.class, analyze("lambda state: state.has('A', player").node());
        assertEquals(ErrorSubtype.AST_PARSE, error.subtype());
        assertEquals("def __analyzed_func__(state):\n    return (state.has('A', player)", error.cleanedSource());
    }

    @Test
    void visitationErrorsCarryTheLogs() {
        var result = analyze("lambda state: state.has('A', player) and {'a': 1}");

        var error = assertInstanceOf(ErrorNode.class, result.node());
        assertEquals(ErrorSubtype.VISITATION, error.subtype());
        assertEquals(1, error.errorLog().size());
        assertTrue(error.errorLog().get(0).message().startsWith("Unsupported dict"), error.errorLog()::toString);
        assertFalse(error.debugLog().isEmpty());
        assertEquals(error.errorLog(), result.errorLog());
    }

    @Test
    void handlerFailuresAreUnexpected() {
        var fn = SourcePredicate.builder("rule").source("lambda state: boom(state)").build();
        var handler = new GameHandler() {
            @Override
            public RuleNode handleSpecialFunctionCall(String name, List<RuleNode> args) {
                throw new IllegalStateException("Handler exploded");
            }
        };

        var error = assertInstanceOf(ErrorNode.class,
                ANALYZER.analyze(AnalysisRequest.of(fn).withHandler(handler)).node());
        assertEquals(ErrorSubtype.UNEXPECTED, error.subtype());
        assertNotNull(error.traceback());
        assertTrue(error.traceback().contains("Handler exploded"));
    }

    @Test
    void invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RuleAnalyzer(Set.of(), new SourceLocator(), 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RecursionGuard(0));
    }

    private static ErrorSubtype subtype(AnalysisResult result) {
        return assertInstanceOf(ErrorNode.class, result.node(), result::toString).subtype();
    }
}
