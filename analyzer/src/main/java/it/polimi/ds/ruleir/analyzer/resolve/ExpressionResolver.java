package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.fn.Parameter;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.ir.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves lowered expressions to the values they denote, whenever those are known at analysis time.
 */
public final class ExpressionResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionResolver.class);

    private final Environment env;
    private final @Nullable PredicateFunction fn;

    public ExpressionResolver(Environment env, @Nullable PredicateFunction fn) {
        this.env = env;
        this.fn = fn;
    }

    /**
     * Looks a name up in the environment, then in the default values of the function's parameters, then in its
     * module globals.
     *
     * @return the value, or null if the name is unknown
     */
    public @Nullable Object resolveVariable(String name) {
        if (env.contains(name))
            return env.get(name);

        if (fn == null)
            return null;

        for (Parameter parameter : fn.parameters()) {
            if (parameter.hasDefault() && parameter.name().equals(name)) {
                LOGGER.debug("Resolved {} to the default value {}", name, parameter.defaultValue());
                return parameter.defaultValue();
            }
        }

        if (fn.globals().containsKey(name)) {
            LOGGER.debug("Resolved {} to a global of {}", name, fn.name());
            return fn.globals().get(name);
        }
        return null;
    }

    /**
     * @return the value of the expression, or null if it cannot be resolved
     */
    public @Nullable Object resolve(@Nullable RuleNode node) {
        if (node == null)
            return null;

        return switch (node.getType()) {
            case CONSTANT -> ((ConstantNode) node).value();
            case NAME -> resolveVariable(((NameNode) node).name());
            case SUBSCRIPT -> {
                var subscript = (SubscriptNode) node;
                final Object value = resolve(subscript.value());
                final Object index = resolve(subscript.index());
                yield value != null && index != null ? PyValues.subscript(value, index) : null;
            }
            case ATTRIBUTE -> {
                var attribute = (AttributeNode) node;
                final Object object = resolve(attribute.object());
                yield object != null ? Attributes.get(object, attribute.attr()) : null;
            }
            case BINARY_OP -> {
                var binary = (BinaryOpNode) node;
                yield PyValues.binary(binary.op(), resolve(binary.left()), resolve(binary.right()));
            }
            default -> null;
        };
    }
}
