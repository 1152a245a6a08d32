package it.polimi.ds.ruleir.analyzer.source;

import it.polimi.ds.ruleir.tree.*;
import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds the lambdas a rules file passes to {@code set_rule}, {@code add_rule} and {@code add_item_rule} for a
 * location, entrance or region, e.g. {@code set_rule(world.get_location("Name", player), lambda state: ...)}.
 */
public final class RuleTargetFinder extends TreeScanner<List<RuleTargetFinder.RuleTarget>> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleTargetFinder.class);
    private static final RuleTargetFinder INSTANCE = new RuleTargetFinder();

    private static final Set<String> RULE_SETTERS = Set.of("set_rule", "add_rule", "add_item_rule");
    private static final Set<String> TARGET_GETTERS = Set.of("get_location", "get_entrance", "get_region");

    public record RuleTarget(String name, String setter, LambdaTree rule) {
    }

    private RuleTargetFinder() {
    }

    /**
     * @return every rule in the tree, in source order
     */
    public static @Unmodifiable List<RuleTarget> findAll(Tree tree) {
        final List<RuleTarget> targets = new ArrayList<>();
        INSTANCE.scan(tree, targets);
        return List.copyOf(targets);
    }

    /**
     * @return the rule of the given target, or null if there is none or more than one
     */
    public static @Nullable LambdaTree find(Tree tree, String targetName) {
        final List<LambdaTree> found = findAll(tree).stream()
                .filter(t -> t.name().equals(targetName))
                .map(RuleTarget::rule)
                .toList();
        if (found.size() == 1)
            return found.get(0);

        LOGGER.warn("Found {} rules for target {}, cannot pick one", found.size(), targetName);
        return null;
    }

    @Override
    public @Nullable Void visitCall(CallTree node, List<RuleTarget> targets) {
        final String setter = calleeName(node.function());
        if (setter != null && RULE_SETTERS.contains(setter) && node.arguments().size() >= 2) {
            final String target = targetName(node.arguments().get(0));
            if (target != null && node.arguments().get(1) instanceof LambdaTree rule)
                targets.add(new RuleTarget(target, setter, rule));
        }
        return super.visitCall(node, targets);
    }

    private static @Nullable String calleeName(ExpressionTree function) {
        if (function instanceof NameTree name)
            return name.name();
        if (function instanceof AttributeTree attribute)
            return attribute.name();
        return null;
    }

    private static @Nullable String targetName(ExpressionTree arg) {
        if (arg instanceof CallTree call
                && call.function() instanceof AttributeTree getter
                && TARGET_GETTERS.contains(getter.name())
                && !call.arguments().isEmpty()
                && call.arguments().get(0) instanceof LiteralTree literal
                && literal.value() instanceof String name)
            return name;
        return null;
    }
}
