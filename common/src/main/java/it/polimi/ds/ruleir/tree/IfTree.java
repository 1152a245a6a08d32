package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * An {@code if} statement. {@code elif} chains are represented as a nested {@code IfTree} as the only statement
 * of {@link #orElse()}.
 */
public record IfTree(ExpressionTree condition,
                     List<StatementTree> body,
                     List<StatementTree> orElse,
                     Span span) implements StatementTree {

    public IfTree {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitIf(this, p);
    }
}
