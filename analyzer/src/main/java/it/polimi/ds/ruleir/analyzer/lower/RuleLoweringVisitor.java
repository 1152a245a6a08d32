package it.polimi.ds.ruleir.analyzer.lower;

import it.polimi.ds.ruleir.analyzer.GameHandler;
import it.polimi.ds.ruleir.analyzer.RecursionGuard;
import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.analyzer.resolve.CollectionFolder;
import it.polimi.ds.ruleir.analyzer.resolve.ExpressionResolver;
import it.polimi.ds.ruleir.analyzer.resolve.PyValues;
import it.polimi.ds.ruleir.ir.*;
import it.polimi.ds.ruleir.tree.*;
import org.jspecify.annotations.Nullable;

import java.util.*;

/**
 * Lowers a parsed predicate into a {@link RuleNode}.
 * <p>
 * Statements lower their first meaningful statement, so a function body lowers to the expression it returns.
 * Whatever cannot be lowered returns null; the root cause of the failure is recorded in the error log of
 * {@link Ctx#log()}, while nodes that merely propagate the failure of a child do not log anything.
 */
@SuppressWarnings({
        "ClassEscapesDefinedScope" // There's no way to get an instance of this class, it can't escape
})
public final class RuleLoweringVisitor extends ThrowingTreeVisitor<@Nullable RuleNode, RuleLoweringVisitor.Ctx> {

    private static final RuleLoweringVisitor INSTANCE = new RuleLoweringVisitor();

    private static final Set<String> RULE_SETTERS = Set.of("set_rule", "add_rule", "add_item_rule");
    private static final Set<String> SPECIAL_ARGUMENTS = Set.of("state", "player", "world");
    private static final Set<String> ORDER_INDEPENDENT_METHODS = Set.of("has_all", "has_any", "has_all_counts");

    private RuleLoweringVisitor() {
    }

    public static @Nullable RuleNode lower(Tree tree, Ctx ctx) {
        return tree.accept(INSTANCE, ctx);
    }

    public record Ctx(AnalysisLog log,
                      Environment env,
                      @Nullable PredicateFunction function,
                      ExpressionResolver resolver,
                      CollectionFolder folder,
                      RecursionGuard guard,
                      GameHandler handler,
                      int player,
                      HelperInliner inliner) {
    }

    private record Argument(ExpressionTree tree, RuleNode node) {
    }

    @Override
    protected @Nullable RuleNode visitUnsupported(Tree node, Ctx ctx) {
        ctx.log.error("Unsupported " + describe(node));
        return null;
    }

    private static String describe(Tree node) {
        return node.getKind().name().toLowerCase(Locale.ROOT) + " at line " + node.getStartLine();
    }

    private @Nullable RuleNode lowerChild(@Nullable Tree node, Ctx ctx) {
        return node == null ? null : node.accept(this, ctx);
    }

    private @Nullable List<RuleNode> lowerAll(List<? extends Tree> nodes, Ctx ctx) {
        final List<RuleNode> lowered = new ArrayList<>(nodes.size());
        for (Tree node : nodes) {
            final RuleNode result = lowerChild(node, ctx);
            if (result == null)
                return null;
            lowered.add(result);
        }
        return lowered;
    }

    // Statements

    @Override
    public @Nullable RuleNode visitModule(ModuleTree node, Ctx ctx) {
        if (node.body().isEmpty()) {
            ctx.log.debug("Module is empty");
            return null;
        }
        return lowerChild(node.body().get(0), ctx);
    }

    @Override
    public @Nullable RuleNode visitFunctionDef(FunctionDefTree node, Ctx ctx) {
        ctx.log.debug("Lowering function {}", node.name());
        List<StatementTree> body = node.body();
        if (!body.isEmpty()
                && body.get(0) instanceof ExpressionStatementTree docstring
                && docstring.expression() instanceof LiteralTree literal
                && literal.value() instanceof String) {
            ctx.log.debug("Skipping docstring of {}", node.name());
            body = body.subList(1, body.size());
        }

        if (body.isEmpty()) {
            ctx.log.debug("Function {} has no body", node.name());
            return null;
        }
        return lowerChild(body.get(0), ctx);
    }

    @Override
    public @Nullable RuleNode visitReturn(ReturnTree node, Ctx ctx) {
        if (node.value() == null) {
            ctx.log.error("Return without a value at line " + node.getStartLine());
            return null;
        }
        return lowerChild(node.value(), ctx);
    }

    @Override
    public @Nullable RuleNode visitExpressionStatement(ExpressionStatementTree node, Ctx ctx) {
        if (node.expression() instanceof CallTree call
                && RULE_SETTERS.contains(calleeName(call.function()))
                && call.arguments().size() >= 2) {
            ctx.log.debug("Lowering the rule passed to {}", calleeName(call.function()));
            return lowerChild(call.arguments().get(1), ctx);
        }
        return lowerChild(node.expression(), ctx);
    }

    @Override
    public @Nullable RuleNode visitAssignment(AssignmentTree node, Ctx ctx) {
        return lowerChild(node.value(), ctx);
    }

    @Override
    public @Nullable RuleNode visitIf(IfTree node, Ctx ctx) {
        final RuleNode test = lowerChild(node.condition(), ctx);
        final RuleNode ifTrue = node.body().isEmpty() ? null : lowerChild(node.body().get(0), ctx);
        final RuleNode ifFalse = node.orElse().isEmpty() ? null : lowerChild(node.orElse().get(0), ctx);
        if (test == null || ifTrue == null)
            return null;
        return new ConditionalNode(test, ifTrue, ifFalse);
    }

    // Expressions

    @Override
    public @Nullable RuleNode visitLambda(LambdaTree node, Ctx ctx) {
        return lowerChild(node.body(), ctx);
    }

    @Override
    public @Nullable RuleNode visitBoolOp(BoolOpTree node, Ctx ctx) {
        final List<RuleNode> conditions = lowerAll(node.values(), ctx);
        if (conditions == null)
            return null;
        return switch (node.operator()) {
            case AND -> new AndNode(conditions);
            case OR -> new OrNode(conditions);
        };
    }

    @Override
    public @Nullable RuleNode visitUnary(UnaryTree node, Ctx ctx) {
        final RuleNode operand = lowerChild(node.operand(), ctx);
        if (operand == null)
            return null;

        if (node.operator() != UnaryTree.Operator.NOT) {
            ctx.log.error("Unsupported unary operator " + node.operator().symbol().strip() + " at line " +
                    node.getStartLine());
            return null;
        }
        return new NotNode(operand);
    }

    @Override
    public @Nullable RuleNode visitCompare(CompareTree node, Ctx ctx) {
        if (node.operators().size() != 1) {
            ctx.log.error("Unsupported chained comparison at line " + node.getStartLine());
            return null;
        }

        final RuleNode left = lowerChild(node.left(), ctx);
        final RuleNode right = lowerChild(node.comparators().get(0), ctx);
        if (left == null || right == null)
            return null;
        return new CompareNode(left, node.operators().get(0).symbol(), right);
    }

    @Override
    public @Nullable RuleNode visitConditionalExpression(ConditionalExpressionTree node, Ctx ctx) {
        final RuleNode test = lowerChild(node.condition(), ctx);
        final RuleNode ifTrue = lowerChild(node.trueExpression(), ctx);
        final RuleNode ifFalse = lowerChild(node.falseExpression(), ctx);
        if (test == null || ifTrue == null || ifFalse == null)
            return null;
        return new ConditionalNode(test, ifTrue, ifFalse);
    }

    @Override
    public @Nullable RuleNode visitBinary(BinaryTree node, Ctx ctx) {
        if (node.operator() == BinaryTree.Operator.MAT_MULT) {
            ctx.log.error("Unsupported binary operator @ at line " + node.getStartLine());
            return null;
        }

        final RuleNode left = lowerChild(node.left(), ctx);
        final RuleNode right = lowerChild(node.right(), ctx);
        if (left == null || right == null)
            return null;

        final String op = node.operator().symbol();
        final RuleNode folded = ctx.folder.foldBinary(left, op, right);
        if (folded != null) {
            ctx.log.debug("Folded binary operation {} at line {}", op, node.getStartLine());
            return folded;
        }
        return new BinaryOpNode(left, op, right);
    }

    @Override
    public @Nullable RuleNode visitCollectionLiteral(CollectionLiteralTree node, Ctx ctx) {
        final List<RuleNode> elements = lowerAll(node.elements(), ctx);
        if (elements == null)
            return null;

        if (node.type() == CollectionLiteralTree.Type.SET
                && elements.stream().allMatch(e -> e instanceof ConstantNode)) {
            elements.sort(Comparator.comparing(e -> ((ConstantNode) e).value(), PyValues.SORT_ORDER));
        }
        return new ListNode(elements);
    }

    @Override
    public @Nullable RuleNode visitName(NameTree node, Ctx ctx) {
        final String name = node.name();
        if (ctx.env.contains(name)) {
            final ConstantNode constant = PyValues.nameConstant(ctx.env.get(name));
            if (constant != null) {
                ctx.log.debug("Resolved {} from the environment to {}", name, constant.value());
                return constant;
            }
        } else {
            final Object value = ctx.resolver.resolveVariable(name);
            final ConstantNode constant = value != null ? PyValues.nameConstant(value) : null;
            if (constant != null) {
                ctx.log.debug("Resolved {} from defaults or globals to {}", name, constant.value());
                return constant;
            }
        }

        final String replaced = ctx.handler.replaceName(name);
        if (!replaced.equals(name))
            ctx.log.debug("Game handler replaced {} with {}", name, replaced);
        return new NameNode(replaced);
    }

    @Override
    public @Nullable RuleNode visitLiteral(LiteralTree node, Ctx ctx) {
        return new ConstantNode(node.value());
    }

    @Override
    public @Nullable RuleNode visitSubscript(SubscriptTree node, Ctx ctx) {
        final RuleNode value = lowerChild(node.object(), ctx);
        final RuleNode index = lowerChild(node.index(), ctx);
        if (value == null || index == null)
            return null;
        return new SubscriptNode(value, index);
    }

    @Override
    public @Nullable RuleNode visitAttribute(AttributeTree node, Ctx ctx) {
        final RuleNode object = lowerChild(node.object(), ctx);
        if (object == null)
            return null;
        return new AttributeNode(object, node.name());
    }

    @Override
    public @Nullable RuleNode visitComprehensionExpression(ComprehensionExpressionTree node, Ctx ctx) {
        if (node.type() != ComprehensionExpressionTree.Type.GENERATOR)
            return visitUnsupported(node, ctx);

        if (node.generators().size() != 1) {
            ctx.log.error("Unsupported generator expression with " + node.generators().size() +
                    " for clauses at line " + node.getStartLine());
            return null;
        }

        final RuleNode element = lowerChild(node.element(), ctx);
        final RuleNode comprehension = lowerChild(node.generators().get(0), ctx);
        if (element == null || !(comprehension instanceof ComprehensionDetailsNode details))
            return null;
        return new GeneratorExpressionNode(element, details);
    }

    @Override
    public @Nullable RuleNode visitComprehension(ComprehensionTree node, Ctx ctx) {
        if (!node.conditions().isEmpty())
            ctx.log.debug("Ignoring the if clauses of the comprehension at line {}", node.getStartLine());

        final RuleNode target = lowerChild(node.target(), ctx);
        final RuleNode iterator = lowerChild(node.iterator(), ctx);
        if (target == null || iterator == null)
            return null;
        return new ComprehensionDetailsNode(target, iterator);
    }

    // Calls

    @Override
    public @Nullable RuleNode visitCall(CallTree node, Ctx ctx) {
        if (!node.keywords().isEmpty()) {
            ctx.log.error("Unsupported keyword arguments in call at line " + node.getStartLine());
            return null;
        }

        final RuleNode function = lowerChild(node.function(), ctx);

        final List<Argument> args = new ArrayList<>(node.arguments().size());
        for (int i = 0; i < node.arguments().size(); i++) {
            final ExpressionTree arg = node.arguments().get(i);
            final RuleNode lowered = lowerChild(arg, ctx);
            if (lowered == null) {
                ctx.log.debug("Dropping argument {} of the call at line {}", i, node.getStartLine());
                continue;
            }
            args.add(new Argument(arg, lowered));
        }

        if (function == null)
            return null;

        if (function instanceof NameNode name)
            return lowerNamedCall(node, name.name(), args, ctx);

        if (function instanceof AttributeNode attribute && attribute.object() instanceof NameNode receiver) {
            if (receiver.name().equals("state"))
                return lowerStateMethod(attribute.attr(), args, ctx);
            if (receiver.name().equals("self")) {
                ctx.log.debug("Keeping self.{} as a helper", attribute.attr());
                return new HelperNode(attribute.attr(), filterSpecialArguments(args));
            }
        }

        return new FunctionCallNode(function, filterSpecialArguments(args));
    }

    private @Nullable RuleNode lowerNamedCall(CallTree node, String name, List<Argument> args, Ctx ctx) {
        final List<RuleNode> resolved = new ArrayList<>();
        for (RuleNode arg : filterSpecialArguments(args)) {
            if (arg instanceof NameNode argName) {
                if (argName.name().equals("world"))
                    continue;
                resolved.add(resolveToConstant(arg, ctx.resolver.resolveVariable(argName.name()), ctx));
            } else if (arg instanceof AttributeNode) {
                resolved.add(resolveToConstant(arg, ctx.resolver.resolve(arg), ctx));
            } else {
                resolved.add(arg);
            }
        }

        final RuleNode special = ctx.handler.handleSpecialFunctionCall(name, resolved);
        if (special != null) {
            ctx.log.debug("Game handler lowered the call to {}", name);
            return special;
        }

        if (ctx.env.get(name) instanceof PredicateFunction helper
                && passesState(node)
                && !ctx.handler.shouldPreserveAsHelper(name)) {
            ctx.log.debug("Inlining helper {}", name);
            final RuleNode inlined = ctx.inliner.inline(helper, ctx);
            if (inlined != null)
                return inlined;
            ctx.log.debug("Could not inline helper {}, keeping it as a helper", name);
        }

        if (name.equals("all") && resolved.size() == 1 && resolved.get(0) instanceof GeneratorExpressionNode generator)
            return lowerAllOf(generator, ctx);

        if (name.equals("zip")) {
            final RuleNode folded = ctx.folder.foldZip(resolved);
            if (folded != null)
                return folded;
        }

        if (name.equals("len") && resolved.size() == 1) {
            final RuleNode folded = ctx.folder.foldLen(resolved.get(0));
            if (folded != null)
                return folded;
        }

        return new HelperNode(name, resolved);
    }

    private RuleNode lowerAllOf(GeneratorExpressionNode generator, Ctx ctx) {
        final ComprehensionDetailsNode details = generator.comprehension();
        if (details.iterator() instanceof NameNode iterator
                && ctx.resolver.resolveVariable(iterator.name()) instanceof List<?> items
                && !items.isEmpty()
                && items.stream().allMatch(item -> item instanceof PredicateFunction)) {
            ctx.log.debug("Expanding all() over the {} functions in {}", items.size(), iterator.name());

            final List<RuleNode> conditions = new ArrayList<>(items.size());
            for (Object item : items) {
                final RuleNode inlined = ctx.inliner.inline((PredicateFunction) item, ctx);
                if (inlined == null) {
                    ctx.log.debug("Could not expand all() over {}", iterator.name());
                    return new AllOfNode(generator.element(), details);
                }
                conditions.add(inlined);
            }
            return conditions.size() == 1 ? conditions.get(0) : new AndNode(conditions);
        }
        return new AllOfNode(generator.element(), details);
    }

    private RuleNode lowerStateMethod(String method, List<Argument> args, Ctx ctx) {
        ctx.log.debug("Lowering state.{}", method);
        final List<RuleNode> resolved = new ArrayList<>();
        for (RuleNode arg : filterSpecialArguments(args))
            resolved.add(resolveStateArgument(arg, ctx));

        if (ORDER_INDEPENDENT_METHODS.contains(method)
                && !resolved.isEmpty()
                && resolved.get(0) instanceof ConstantNode constant)
            resolved.set(0, sorted(constant));

        switch (method) {
            case "has" -> {
                if (!resolved.isEmpty())
                    return new ItemCheckNode(resolved.get(0), resolved.size() >= 2 ? count(resolved.get(1), ctx) : null);
            }
            case "has_group" -> {
                if (!resolved.isEmpty())
                    return new GroupCheckNode(resolved.get(0));
            }
            case "has_any" -> {
                final List<RuleNode> items = resolved.isEmpty() ? null : listElements(resolved.get(0));
                if (items != null)
                    return new OrNode(items.stream().<RuleNode>map(ItemCheckNode::new).toList());
            }
            case "_lttp_has_key" -> {
                if (!resolved.isEmpty())
                    return new CountCheckNode(resolved.get(0), resolved.size() >= 2 ? resolved.get(1) : ConstantNode.ONE);
            }
            default -> {
                // Kept as a generic state method
            }
        }
        return new StateMethodNode(method, resolved);
    }

    private static RuleNode count(RuleNode arg, Ctx ctx) {
        final Object value = ctx.resolver.resolve(arg);
        return PyValues.isInt(value) ? new ConstantNode(PyValues.toJson(value)) : arg;
    }

    private static ConstantNode sorted(ConstantNode constant) {
        if (constant.value() instanceof List<?> list && list.stream().allMatch(e -> e instanceof String)) {
            final List<String> sorted = new ArrayList<>();
            list.forEach(e -> sorted.add((String) e));
            Collections.sort(sorted);
            return new ConstantNode(sorted);
        }

        if (constant.value() instanceof Map<?, ?> map) {
            final Map<String, @Nullable Object> sorted = new LinkedHashMap<>();
            map.keySet().stream()
                    .map(String.class::cast)
                    .sorted()
                    .forEach(k -> sorted.put(k, map.get(k)));
            return new ConstantNode(sorted);
        }
        return constant;
    }

    private static @Nullable List<RuleNode> listElements(RuleNode node) {
        if (node instanceof ListNode list)
            return list.value();
        if (node instanceof ConstantNode constant && constant.value() instanceof List<?> values)
            return values.stream().<RuleNode>map(ConstantNode::new).toList();
        return null;
    }

    private static RuleNode resolveStateArgument(RuleNode arg, Ctx ctx) {
        return switch (arg.getType()) {
            case NAME -> resolveToConstant(arg, ctx.resolver.resolveVariable(((NameNode) arg).name()), ctx);
            case BINARY_OP, ATTRIBUTE -> resolveToConstant(arg, ctx.resolver.resolve(arg), ctx);
            case LIST -> {
                final List<@Nullable Object> values = new ArrayList<>();
                for (RuleNode element : ((ListNode) arg).value()) {
                    final Object value = switch (element.getType()) {
                        case CONSTANT -> ((ConstantNode) element).value();
                        case ATTRIBUTE -> ctx.resolver.resolve(element);
                        case NAME -> ctx.resolver.resolveVariable(((NameNode) element).name());
                        default -> null;
                    };

                    if (element instanceof ConstantNode constant)
                        values.add(constant.value());
                    else if (PyValues.isSimple(value))
                        values.add(PyValues.argumentConstant(Objects.requireNonNull(value)).value());
                    else {
                        ctx.log.debug("Could not resolve every element of the list argument, keeping it as is");
                        yield arg;
                    }
                }
                yield new ConstantNode(values);
            }
            default -> arg;
        };
    }

    private static RuleNode resolveToConstant(RuleNode arg, @Nullable Object value, Ctx ctx) {
        if (value == null || !PyValues.isSimple(value))
            return arg;

        final ConstantNode constant = PyValues.argumentConstant(value);
        ctx.log.debug("Resolved argument {} to {}", arg.getType().jsonName(), constant.value());
        return constant;
    }

    private static List<RuleNode> filterSpecialArguments(List<Argument> args) {
        final List<RuleNode> filtered = new ArrayList<>(args.size());
        for (Argument arg : args) {
            if (!isSpecialArgument(arg.tree()))
                filtered.add(arg.node());
        }
        return filtered;
    }

    private static boolean isSpecialArgument(ExpressionTree arg) {
        return arg instanceof NameTree name && SPECIAL_ARGUMENTS.contains(name.name())
                || arg instanceof AttributeTree attribute && attribute.name().equals("player");
    }

    private static boolean passesState(CallTree node) {
        return node.arguments().stream()
                .anyMatch(arg -> arg instanceof NameTree name && name.name().equals("state"));
    }

    private static @Nullable String calleeName(ExpressionTree function) {
        if (function instanceof NameTree name)
            return name.name();
        if (function instanceof AttributeTree attribute)
            return attribute.name();
        return null;
    }
}
