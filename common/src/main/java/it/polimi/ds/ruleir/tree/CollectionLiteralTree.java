package it.polimi.ds.ruleir.tree;

import java.util.List;

public record CollectionLiteralTree(Type type, List<ExpressionTree> elements, Span span) implements ExpressionTree {

    public enum Type { TUPLE, LIST, SET }

    public CollectionLiteralTree {
        elements = List.copyOf(elements);
    }

    @Override
    public Kind getKind() {
        return Kind.COLLECTION_LITERAL;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitCollectionLiteral(this, p);
    }
}
