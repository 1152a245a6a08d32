package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * A block statement the predicate language does not give meaning to ({@code for}, {@code while}, {@code with},
 * {@code try}, {@code class}, ...). Only the statements of its clauses are kept, in source order, so that nested
 * definitions can still be found.
 */
public record CompoundStatementTree(String keyword, List<StatementTree> body, Span span) implements StatementTree {

    public CompoundStatementTree {
        body = List.copyOf(body);
    }

    @Override
    public Kind getKind() {
        return Kind.COMPOUND_STATEMENT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitCompoundStatement(this, p);
    }
}
