package it.polimi.ds.ruleir.tree;

/**
 * {@code trueExpression if condition else falseExpression}.
 */
public record ConditionalExpressionTree(ExpressionTree condition,
                                        ExpressionTree trueExpression,
                                        ExpressionTree falseExpression,
                                        Span span) implements ExpressionTree {

    @Override
    public Kind getKind() {
        return Kind.CONDITIONAL_EXPRESSION;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitConditionalExpression(this, p);
    }
}
