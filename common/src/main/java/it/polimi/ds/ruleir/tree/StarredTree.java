package it.polimi.ds.ruleir.tree;

public record StarredTree(ExpressionTree value, Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.STARRED;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitStarred(this, p);
    }
}
