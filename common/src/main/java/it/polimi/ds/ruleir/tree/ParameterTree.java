package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

/**
 * A declared parameter of a function definition or lambda.
 *
 * @param name the parameter name, without any star prefix
 * @param type whether this is a plain, {@code *args} or {@code **kwargs} parameter
 * @param defaultValue the default value expression, if any
 * @param span location
 */
public record ParameterTree(String name, Type type, @Nullable ExpressionTree defaultValue, Span span) implements Tree {

    public enum Type { PLAIN, VAR_POSITIONAL, VAR_KEYWORD }

    @Override
    public Kind getKind() {
        return Kind.PARAMETER;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitParameter(this, p);
    }
}
