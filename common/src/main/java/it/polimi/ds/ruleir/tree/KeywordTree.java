package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

/**
 * A keyword argument {@code name=value}, or {@code **value} when the name is null.
 */
public record KeywordTree(@Nullable String name, ExpressionTree value, Span span) implements Tree {

    @Override
    public Kind getKind() {
        return Kind.KEYWORD;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitKeyword(this, p);
    }
}
