package it.polimi.ds.ruleir.tree;

/**
 * A simple statement kept only as its leading keyword ({@code import}, {@code pass}, {@code raise}, ...).
 */
public record KeywordStatementTree(String keyword, Span span) implements StatementTree {

    @Override
    public Kind getKind() {
        return Kind.KEYWORD_STATEMENT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitKeywordStatement(this, p);
    }
}
