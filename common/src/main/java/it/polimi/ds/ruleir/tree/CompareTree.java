package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * A comparison. Chained comparisons ({@code a < b < c}) keep all their operators, so that
 * {@code operators.size() == comparators.size()}.
 */
public record CompareTree(ExpressionTree left,
                          List<Operator> operators,
                          List<ExpressionTree> comparators,
                          Span span) implements ExpressionTree {

    public enum Operator {
        EQ("=="), NOT_EQ("!="), LT("<"), LT_E("<="), GT(">"), GT_E(">="),
        IS("is"), IS_NOT("is not"), IN("in"), NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public CompareTree {
        operators = List.copyOf(operators);
        comparators = List.copyOf(comparators);
        if (operators.size() != comparators.size() || operators.isEmpty())
            throw new IllegalArgumentException("Expected one comparator per operator, got " +
                    operators.size() + " operators and " + comparators.size() + " comparators");
    }

    @Override
    public Kind getKind() {
        return Kind.COMPARE;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitCompare(this, p);
    }
}
