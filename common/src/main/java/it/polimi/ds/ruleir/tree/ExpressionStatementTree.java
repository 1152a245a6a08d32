package it.polimi.ds.ruleir.tree;

public record ExpressionStatementTree(ExpressionTree expression, Span span) implements StatementTree {

    @Override
    public Kind getKind() {
        return Kind.EXPRESSION_STATEMENT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitExpressionStatement(this, p);
    }
}
