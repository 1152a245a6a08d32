package it.polimi.ds.ruleir.tree;

public record AttributeTree(ExpressionTree object, String name, Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.ATTRIBUTE;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitAttribute(this, p);
    }
}
