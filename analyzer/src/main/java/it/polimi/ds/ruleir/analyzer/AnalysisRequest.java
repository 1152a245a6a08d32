package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.tree.Tree;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What to analyze, and in which context.
 *
 * @param function the function to analyze, or null when {@code tree} is given
 * @param tree an already parsed tree to lower, used when {@code function} is null
 * @param inherited bindings of the calling rule, when a helper is being inlined
 * @param overrides bindings which take precedence over anything the function captures
 * @param guard the guard to share with the caller, or null to use a fresh one
 * @param handler game specific hooks
 * @param player the player the rule is for, or null for the analyzer's default one
 */
public record AnalysisRequest(@Nullable PredicateFunction function,
                              @Nullable Tree tree,
                              Environment inherited,
                              Map<String, @Nullable Object> overrides,
                              @Nullable RecursionGuard guard,
                              GameHandler handler,
                              @Nullable Integer player) {

    public AnalysisRequest {
        overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static AnalysisRequest of(PredicateFunction function) {
        return new AnalysisRequest(function, null, Environment.EMPTY, Map.of(), null, GameHandler.NONE, null);
    }

    public static AnalysisRequest ofTree(Tree tree) {
        return new AnalysisRequest(null, tree, Environment.EMPTY, Map.of(), null, GameHandler.NONE, null);
    }

    public AnalysisRequest withInherited(Environment inherited) {
        return new AnalysisRequest(function, tree, inherited, overrides, guard, handler, player);
    }

    public AnalysisRequest withOverrides(Map<String, @Nullable Object> overrides) {
        return new AnalysisRequest(function, tree, inherited, overrides, guard, handler, player);
    }

    public AnalysisRequest withGuard(RecursionGuard guard) {
        return new AnalysisRequest(function, tree, inherited, overrides, guard, handler, player);
    }

    public AnalysisRequest withHandler(GameHandler handler) {
        return new AnalysisRequest(function, tree, inherited, overrides, guard, handler, player);
    }

    public AnalysisRequest withPlayer(int player) {
        return new AnalysisRequest(function, tree, inherited, overrides, guard, handler, player);
    }
}
