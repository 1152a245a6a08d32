package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.analyzer.fn.ClosureCell;
import it.polimi.ds.ruleir.analyzer.fn.Parameter;
import it.polimi.ds.ruleir.analyzer.fn.SourcePredicate;
import it.polimi.ds.ruleir.analyzer.properties.AnalyzerPropertiesHandler;
import it.polimi.ds.ruleir.analyzer.properties.AnalyzerPropertiesHandlerImpl;
import it.polimi.ds.ruleir.analyzer.source.RuleTargetFinder;
import it.polimi.ds.ruleir.analyzer.source.SourceCache;
import it.polimi.ds.ruleir.ir.JacksonRuleSerde;
import it.polimi.ds.ruleir.ir.RuleJsonSerde;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import it.polimi.ds.ruleir.script.TreeRenderer;
import it.polimi.ds.ruleir.src.WorkDirFileLoader;
import it.polimi.ds.ruleir.tree.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzes the rules of a rules file and prints their IR as JSON.
 * <p>
 * Usage: {@code <rules file> [target name]}. Module level functions of the file are available to the rules as
 * helpers, module level literals as constants.
 */
public final class RuleAnalyzerMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleAnalyzerMain.class);

    private RuleAnalyzerMain() {
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2) {
            LOGGER.error("Usage: <rules file> [target name]");
            System.exit(1);
            return;
        }

        final WorkDirFileLoader fileLoader = new WorkDirFileLoader(Paths.get("./"));
        final AnalyzerPropertiesHandler propsHndl = new AnalyzerPropertiesHandlerImpl(fileLoader);

        if (!fileLoader.resourceExists(args[0])) {
            LOGGER.error("File not found: {}", args[0]);
            System.exit(1);
            return;
        }

        final int failures = analyzeFile(
                new RuleAnalyzer(propsHndl),
                fileLoader.resolvePath(args[0]),
                args.length > 1 ? args[1] : null,
                System.out);
        if (failures > 0)
            System.exit(2);
    }

    /**
     * @return how many rules could not be analyzed
     */
    static int analyzeFile(RuleAnalyzer analyzer,
                           Path file,
                           @Nullable String targetName,
                           PrintStream out) throws IOException {
        final SourceCache.Entry entry;
        try {
            entry = SourceCache.shared().get(file);
        } catch (ScriptSyntaxException ex) {
            LOGGER.error("Failed to parse {} at {}:{}", file, ex.getLine(), ex.getColumn(), ex);
            return 1;
        }

        final List<ClosureCell> moduleScope = moduleScope(file, entry);
        final RuleJsonSerde serde = new JacksonRuleSerde(true);

        int failures = 0;
        for (RuleTargetFinder.RuleTarget target : RuleTargetFinder.findAll(entry.tree())) {
            if (targetName != null && !targetName.equals(target.name()))
                continue;

            final LambdaTree rule = target.rule();
            final SourcePredicate.Builder builder = SourcePredicate.builder(target.name())
                    .file(file, rule.getStartLine())
                    .source(TreeRenderer.render(rule));
            parameters(rule.parameters()).forEach(builder::parameter);
            moduleScope.forEach(builder::capture);

            final AnalysisResult result = analyzer.analyze(builder.build());
            if (result.isError()) {
                LOGGER.error("Failed to analyze the rule of {} ({})", target.name(), target.setter());
                failures++;
            }
            out.println(serde.jsonify(result.node()));
        }
        return failures;
    }

    private static List<ClosureCell> moduleScope(Path file, SourceCache.Entry entry) {
        final List<ClosureCell> cells = new ArrayList<>();
        for (StatementTree statement : entry.tree().body()) {
            if (statement instanceof FunctionDefTree def) {
                cells.add(ClosureCell.empty(def.name()));
            } else if (statement instanceof AssignmentTree assignment
                    && assignment.augmentedOperator() == null
                    && assignment.targets().size() == 1
                    && assignment.targets().get(0) instanceof NameTree name) {
                final Object value = literalValue(assignment.value());
                if (value != null)
                    cells.add(ClosureCell.of(name.name(), value));
            }
        }

        // Helpers see every other helper, themselves included, so they are bound once they all exist
        for (StatementTree statement : entry.tree().body()) {
            if (!(statement instanceof FunctionDefTree def))
                continue;

            final SourcePredicate.Builder builder = SourcePredicate.builder(def.name())
                    .file(file, def.getStartLine())
                    .source(entry.text().substring(def.getStartPosition(), def.getEndPosition()));
            parameters(def.parameters()).forEach(builder::parameter);
            cells.forEach(builder::capture);

            final SourcePredicate helper = builder.build();
            cells.stream()
                    .filter(c -> c.name().equals(def.name()))
                    .forEach(c -> c.set(helper));
        }
        return cells;
    }

    private static List<Parameter> parameters(List<ParameterTree> parameters) {
        final List<Parameter> result = new ArrayList<>(parameters.size());
        for (ParameterTree parameter : parameters) {
            if (parameter.defaultValue() instanceof LiteralTree literal)
                result.add(Parameter.withDefault(parameter.name(), literal.value()));
            else
                result.add(Parameter.of(parameter.name()));
        }
        return result;
    }

    private static @Nullable Object literalValue(ExpressionTree value) {
        if (value instanceof LiteralTree literal)
            return literal.value();

        if (value instanceof CollectionLiteralTree collection) {
            final List<@Nullable Object> values = new ArrayList<>();
            for (ExpressionTree element : collection.elements()) {
                if (!(element instanceof LiteralTree literal))
                    return null;
                values.add(literal.value());
            }
            return values;
        }
        return null;
    }
}
