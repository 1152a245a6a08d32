package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

/**
 * A literal constant.
 *
 * @param value {@code null} for {@code None}, a {@link Boolean}, an {@link Integer}, {@link Long} or
 *              {@link java.math.BigInteger} for integers (the narrowest that fits), a {@link Double} for floats or a
 *              {@link String} (byte strings included)
 * @param span location
 */
public record LiteralTree(@Nullable Object value, Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitLiteral(this, p);
    }
}
