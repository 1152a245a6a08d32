package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * A run of the same boolean operator, flattened: {@code a or b or c} is one node with three values.
 */
public record BoolOpTree(Operator operator, List<ExpressionTree> values, Span span) implements ExpressionTree {

    public enum Operator {
        AND("and"), OR("or");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public BoolOpTree {
        values = List.copyOf(values);
    }

    @Override
    public Kind getKind() {
        return Kind.BOOL_OP;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitBoolOp(this, p);
    }
}
