package it.polimi.ds.ruleir.tree;

public record SubscriptTree(ExpressionTree object, ExpressionTree index, Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.SUBSCRIPT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitSubscript(this, p);
    }
}
