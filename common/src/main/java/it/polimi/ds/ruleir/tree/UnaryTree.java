package it.polimi.ds.ruleir.tree;

public record UnaryTree(Operator operator, ExpressionTree operand, Span span) implements ExpressionTree {

    public enum Operator {
        NOT("not "), NEGATE("-"), PLUS("+"), INVERT("~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitUnary(this, p);
    }
}
