package it.polimi.ds.ruleir.tree;

import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record BinaryTree(ExpressionTree left, Operator operator, ExpressionTree right, Span span)
        implements ExpressionTree {

    public enum Operator {
        ADD("+"), SUB("-"), MULT("*"), MAT_MULT("@"), DIV("/"), FLOOR_DIV("//"), MOD("%"), POW("**"),
        LSHIFT("<<"), RSHIFT(">>"), BIT_OR("|"), BIT_XOR("^"), BIT_AND("&");

        public static final @Unmodifiable List<Operator> VALUES = List.of(values());

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static @Nullable Operator fromSymbol(String symbol) {
            for (Operator op : VALUES) {
                if (op.symbol.equals(symbol))
                    return op;
            }
            return null;
        }
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitBinary(this, p);
    }
}
