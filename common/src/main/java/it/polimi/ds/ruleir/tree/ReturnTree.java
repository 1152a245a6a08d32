package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

public record ReturnTree(@Nullable ExpressionTree value, Span span) implements StatementTree {

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitReturn(this, p);
    }
}
