package it.polimi.ds.ruleir.tree;

public record NameTree(String name, Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.NAME;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitName(this, p);
    }
}
