package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * One {@code for target in iterator [if condition]*} clause of a comprehension.
 */
public record ComprehensionTree(ExpressionTree target,
                                ExpressionTree iterator,
                                List<ExpressionTree> conditions,
                                Span span) implements Tree {

    public ComprehensionTree {
        conditions = List.copyOf(conditions);
    }

    @Override
    public Kind getKind() {
        return Kind.COMPREHENSION;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitComprehension(this, p);
    }
}
