package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.env.EnvironmentBuilder;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.analyzer.lower.AnalysisLog;
import it.polimi.ds.ruleir.analyzer.lower.RuleLoweringVisitor;
import it.polimi.ds.ruleir.analyzer.properties.AnalyzerPropertiesHandler;
import it.polimi.ds.ruleir.analyzer.resolve.CollectionFolder;
import it.polimi.ds.ruleir.analyzer.resolve.ExpressionResolver;
import it.polimi.ds.ruleir.analyzer.source.SourceLocator;
import it.polimi.ds.ruleir.analyzer.source.SourceLookup;
import it.polimi.ds.ruleir.analyzer.source.SourceNormalizer;
import it.polimi.ds.ruleir.ir.ErrorNode;
import it.polimi.ds.ruleir.ir.ErrorSubtype;
import it.polimi.ds.ruleir.ir.RuleNode;
import it.polimi.ds.ruleir.script.ScriptParser;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import it.polimi.ds.ruleir.tree.ModuleTree;
import it.polimi.ds.ruleir.tree.Tree;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the analysis: lowers a predicate function into a {@link RuleNode}.
 * <p>
 * Failures never escape {@link #analyze(AnalysisRequest)}, they are returned as an {@link ErrorNode} instead.
 * Helpers called by the analyzed function are inlined by analyzing them recursively with the same guard.
 */
public final class RuleAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleAnalyzer.class);

    private final EnvironmentBuilder environmentBuilder;
    private final SourceLocator locator;
    private final int recursionLimit;
    private final int defaultPlayer;

    public RuleAnalyzer() {
        this(Set.of(), new SourceLocator(), RecursionGuard.DEFAULT_LIMIT, 1);
    }

    public RuleAnalyzer(AnalyzerPropertiesHandler propsHndl) {
        this(propsHndl.getGlobalWhitelist(),
                new SourceLocator(),
                propsHndl.getRecursionLimit(),
                propsHndl.getDefaultPlayer());
    }

    public RuleAnalyzer(Set<String> globalWhitelist, SourceLocator locator, int recursionLimit, int defaultPlayer) {
        if (recursionLimit < 1)
            throw new IllegalArgumentException("Recursion limit must be at least 1, got " + recursionLimit);

        this.environmentBuilder = new EnvironmentBuilder(globalWhitelist);
        this.locator = locator;
        this.recursionLimit = recursionLimit;
        this.defaultPlayer = defaultPlayer;
    }

    public AnalysisResult analyze(PredicateFunction fn) {
        return analyze(AnalysisRequest.of(fn));
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        final AnalysisLog log = new AnalysisLog();
        final RecursionGuard guard = request.guard() != null ? request.guard() : new RecursionGuard(recursionLimit);
        final int player = request.player() != null ? request.player() : defaultPlayer;

        try {
            final PredicateFunction fn = request.function();
            if (fn != null)
                return analyzeFunction(fn, request, guard, player, log);

            final Tree tree = request.tree();
            if (tree != null) {
                final Environment env = environmentBuilder.build(request.inherited(), request.overrides());
                return lower(tree, env, null, request, guard, player, log);
            }

            return failure(log, ErrorSubtype.NO_RESULT, "Nothing to analyze, neither a function nor a tree was given");
        } catch (RuntimeException ex) {
            final String name = request.function() != null ? request.function().name() : "tree";
            LOGGER.error("Unexpected failure while analyzing {}", name, ex);
            return failure(log,
                    ErrorSubtype.UNEXPECTED,
                    "Unexpected error while analyzing " + name + ": " + ex,
                    null,
                    AnalysisLog.stackTrace(ex));
        }
    }

    private AnalysisResult analyzeFunction(PredicateFunction fn,
                                           AnalysisRequest request,
                                           RecursionGuard guard,
                                           int player,
                                           AnalysisLog log) {
        if (guard.isAtLimit(fn))
            return failure(log, ErrorSubtype.RECURSION, "Recursion limit of " + guard.limit() +
                    " reached while analyzing " + fn.name());

        log.debug("Analyzing {}", fn.name());
        final Environment env = environmentBuilder.build(fn, request.inherited(), request.overrides());

        final SourceLookup lookup = locator.locate(fn);
        if (!lookup.isFound())
            return failure(log, ErrorSubtype.SOURCE_CLEANING, Objects.requireNonNull(lookup.failure()));

        final String cleanedSource = SourceNormalizer.normalize(Objects.requireNonNull(lookup.text()));
        if (cleanedSource == null)
            return failure(log, ErrorSubtype.SOURCE_CLEANING, "Could not normalize the source of " + fn.name());
        log.debug("Normalized source of {}: {}", fn.name(), cleanedSource);

        final ModuleTree tree;
        try {
            tree = ScriptParser.parse(cleanedSource);
        } catch (ScriptSyntaxException ex) {
            log.debug("Syntax error at {}:{}", ex.getLine(), ex.getColumn());
            return failure(log,
                    ErrorSubtype.AST_PARSE,
                    "Could not parse the source of " + fn.name() + ": " + ex.getMessage(),
                    cleanedSource,
                    null);
        }

        try (RecursionGuard.Scope ignored = guard.enter(fn)) {
            return lower(tree, env, fn, request, guard, player, log);
        }
    }

    private AnalysisResult lower(Tree tree,
                                 Environment env,
                                 @Nullable PredicateFunction fn,
                                 AnalysisRequest request,
                                 RecursionGuard guard,
                                 int player,
                                 AnalysisLog log) {
        final String name = fn != null ? fn.name() : "tree";
        final RuleNode node = RuleLoweringVisitor.lower(tree, new RuleLoweringVisitor.Ctx(
                log,
                env,
                fn,
                new ExpressionResolver(env, fn),
                new CollectionFolder(request.handler(), player),
                guard,
                request.handler(),
                player,
                this::inline));

        if (log.hasErrors())
            return failure(log, ErrorSubtype.VISITATION, "Errors while lowering " + name);
        if (node == null)
            return failure(log, ErrorSubtype.NO_RESULT, "Lowering " + name + " produced no result");

        log.debug("Lowered {} to {}", name, node.getType().jsonName());
        return new AnalysisResult(node, log.debugLog(), log.errorLog());
    }

    private @Nullable RuleNode inline(PredicateFunction helper, RuleLoweringVisitor.Ctx caller) {
        final AnalysisResult result = analyze(AnalysisRequest.of(helper)
                .withInherited(caller.env())
                .withGuard(caller.guard())
                .withHandler(caller.handler())
                .withPlayer(caller.player()));

        if (result.node() instanceof ErrorNode error) {
            caller.log().debug("Analysis of {} failed with {}: {}",
                    helper.name(), error.subtype().jsonName(), error.message());
            return null;
        }
        return result.node();
    }

    private static AnalysisResult failure(AnalysisLog log, ErrorSubtype subtype, String message) {
        return failure(log, subtype, message, null, null);
    }

    private static AnalysisResult failure(AnalysisLog log,
                                          ErrorSubtype subtype,
                                          String message,
                                          @Nullable String cleanedSource,
                                          @Nullable String traceback) {
        LOGGER.debug("Analysis failed with {}: {}", subtype.jsonName(), message);
        return new AnalysisResult(
                new ErrorNode(message, subtype, log.debugLog(), log.errorLog(), cleanedSource, traceback),
                log.debugLog(),
                log.errorLog());
    }
}
