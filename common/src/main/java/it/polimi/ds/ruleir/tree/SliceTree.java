package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

public record SliceTree(@Nullable ExpressionTree lower,
                        @Nullable ExpressionTree upper,
                        @Nullable ExpressionTree step,
                        Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.SLICE;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitSlice(this, p);
    }
}
