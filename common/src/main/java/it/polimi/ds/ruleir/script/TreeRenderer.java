package it.polimi.ds.ruleir.script;

import it.polimi.ds.ruleir.tree.*;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Prints expression trees back to source text.
 * <p>
 * Parentheses are only added where the precedence of the operators requires them, so parsing the rendered text
 * gives back a structurally equal tree. Statements are not supported.
 */
public final class TreeRenderer extends ThrowingTreeVisitor<@Nullable Void, Integer> {

    private static final int LAMBDA = 0;
    private static final int TERNARY = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARISON = 5;
    private static final int BIT_OR = 6;
    private static final int BIT_XOR = 7;
    private static final int BIT_AND = 8;
    private static final int SHIFT = 9;
    private static final int ARITH = 10;
    private static final int TERM = 11;
    private static final int FACTOR = 12;
    private static final int POWER = 13;
    private static final int PRIMARY = 14;

    private final StringBuilder sb = new StringBuilder();

    private TreeRenderer() {
    }

    public static String render(Tree tree) {
        final TreeRenderer renderer = new TreeRenderer();
        tree.accept(renderer, LAMBDA);
        return renderer.sb.toString();
    }

    @Override
    protected @Nullable Void visitUnsupported(Tree node, Integer minPrecedence) {
        throw new IllegalArgumentException("Cannot render " + node.getKind() + " nodes");
    }

    private void render(@Nullable Tree node, int minPrecedence) {
        if (node != null)
            node.accept(this, minPrecedence);
    }

    private void renderAll(List<? extends Tree> nodes, int minPrecedence) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0)
                sb.append(", ");
            render(nodes.get(i), minPrecedence);
        }
    }

    private boolean open(int precedence, int minPrecedence) {
        final boolean parens = precedence < minPrecedence;
        if (parens)
            sb.append('(');
        return parens;
    }

    private void close(boolean parens) {
        if (parens)
            sb.append(')');
    }

    @Override
    public @Nullable Void visitLambda(LambdaTree node, Integer minPrecedence) {
        final boolean parens = open(LAMBDA, minPrecedence);
        sb.append("lambda");
        if (!node.parameters().isEmpty()) {
            sb.append(' ');
            renderAll(node.parameters(), LAMBDA);
        }
        sb.append(": ");
        render(node.body(), LAMBDA);
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitParameter(ParameterTree node, Integer minPrecedence) {
        switch (node.type()) {
            case VAR_POSITIONAL -> sb.append('*');
            case VAR_KEYWORD -> sb.append("**");
            case PLAIN -> {
            }
        }
        sb.append(node.name());
        if (node.defaultValue() != null) {
            sb.append('=');
            render(node.defaultValue(), TERNARY);
        }
        return null;
    }

    @Override
    public @Nullable Void visitConditionalExpression(ConditionalExpressionTree node, Integer minPrecedence) {
        final boolean parens = open(TERNARY, minPrecedence);
        render(node.trueExpression(), OR);
        sb.append(" if ");
        render(node.condition(), OR);
        sb.append(" else ");
        render(node.falseExpression(), TERNARY);
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitBoolOp(BoolOpTree node, Integer minPrecedence) {
        final int precedence = node.operator() == BoolOpTree.Operator.OR ? OR : AND;
        final boolean parens = open(precedence, minPrecedence);
        for (int i = 0; i < node.values().size(); i++) {
            if (i > 0)
                sb.append(' ').append(node.operator().symbol()).append(' ');
            render(node.values().get(i), precedence + 1);
        }
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitUnary(UnaryTree node, Integer minPrecedence) {
        final int precedence = node.operator() == UnaryTree.Operator.NOT ? NOT : FACTOR;
        final boolean parens = open(precedence, minPrecedence);
        sb.append(node.operator().symbol());
        render(node.operand(), precedence);
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitCompare(CompareTree node, Integer minPrecedence) {
        final boolean parens = open(COMPARISON, minPrecedence);
        render(node.left(), COMPARISON + 1);
        for (int i = 0; i < node.operators().size(); i++) {
            sb.append(' ').append(node.operators().get(i).symbol()).append(' ');
            render(node.comparators().get(i), COMPARISON + 1);
        }
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitBinary(BinaryTree node, Integer minPrecedence) {
        final int precedence = switch (node.operator()) {
            case BIT_OR -> BIT_OR;
            case BIT_XOR -> BIT_XOR;
            case BIT_AND -> BIT_AND;
            case LSHIFT, RSHIFT -> SHIFT;
            case ADD, SUB -> ARITH;
            case MULT, MAT_MULT, DIV, FLOOR_DIV, MOD -> TERM;
            case POW -> POWER;
        };

        final boolean parens = open(precedence, minPrecedence);
        if (node.operator() == BinaryTree.Operator.POW) {
            // Right associative, and binds tighter than a unary operator on its left
            render(node.left(), PRIMARY);
            sb.append(" ** ");
            render(node.right(), FACTOR);
        } else {
            render(node.left(), precedence);
            sb.append(' ').append(node.operator().symbol()).append(' ');
            render(node.right(), precedence + 1);
        }
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitCall(CallTree node, Integer minPrecedence) {
        final boolean parens = open(PRIMARY, minPrecedence);
        render(node.function(), PRIMARY);
        sb.append('(');
        if (node.arguments().size() == 1
                && node.keywords().isEmpty()
                && node.arguments().get(0) instanceof ComprehensionExpressionTree comp
                && comp.type() == ComprehensionExpressionTree.Type.GENERATOR) {
            renderComprehensionBody(comp);
        } else {
            renderAll(node.arguments(), LAMBDA);
            if (!node.arguments().isEmpty() && !node.keywords().isEmpty())
                sb.append(", ");
            renderAll(node.keywords(), LAMBDA);
        }
        sb.append(')');
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitKeyword(KeywordTree node, Integer minPrecedence) {
        if (node.name() == null)
            sb.append("**");
        else
            sb.append(node.name()).append('=');
        render(node.value(), LAMBDA);
        return null;
    }

    @Override
    public @Nullable Void visitStarred(StarredTree node, Integer minPrecedence) {
        sb.append('*');
        render(node.value(), BIT_OR);
        return null;
    }

    @Override
    public @Nullable Void visitAttribute(AttributeTree node, Integer minPrecedence) {
        final boolean parens = open(PRIMARY, minPrecedence);
        render(node.object(), PRIMARY);
        if (node.object() instanceof LiteralTree lit && lit.value() instanceof Integer)
            sb.append(' ');
        sb.append('.').append(node.name());
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitSubscript(SubscriptTree node, Integer minPrecedence) {
        final boolean parens = open(PRIMARY, minPrecedence);
        render(node.object(), PRIMARY);
        sb.append('[');
        if (node.index() instanceof CollectionLiteralTree tuple
                && tuple.type() == CollectionLiteralTree.Type.TUPLE
                && !tuple.elements().isEmpty()) {
            renderAll(tuple.elements(), LAMBDA);
            if (tuple.elements().size() == 1)
                sb.append(',');
        } else {
            render(node.index(), LAMBDA);
        }
        sb.append(']');
        close(parens);
        return null;
    }

    @Override
    public @Nullable Void visitSlice(SliceTree node, Integer minPrecedence) {
        render(node.lower(), LAMBDA);
        sb.append(':');
        render(node.upper(), LAMBDA);
        if (node.step() != null) {
            sb.append(':');
            render(node.step(), LAMBDA);
        }
        return null;
    }

    @Override
    public @Nullable Void visitName(NameTree node, Integer minPrecedence) {
        sb.append(node.name());
        return null;
    }

    @Override
    public @Nullable Void visitLiteral(LiteralTree node, Integer minPrecedence) {
        final Object value = node.value();
        final boolean negative = value instanceof Number n && isNegative(n);
        final boolean parens = negative && open(FACTOR, minPrecedence);
        sb.append(literal(value));
        close(parens);
        return null;
    }

    private static boolean isNegative(Number n) {
        if (n instanceof Double d)
            return d < 0 || (d == 0 && 1 / d < 0);
        return n instanceof BigInteger b ? b.signum() < 0 : n.longValue() < 0;
    }

    @Override
    public @Nullable Void visitCollectionLiteral(CollectionLiteralTree node, Integer minPrecedence) {
        switch (node.type()) {
            case LIST -> {
                sb.append('[');
                renderAll(node.elements(), LAMBDA);
                sb.append(']');
            }
            case SET -> {
                if (node.elements().isEmpty()) {
                    sb.append("set()");
                } else {
                    sb.append('{');
                    renderAll(node.elements(), LAMBDA);
                    sb.append('}');
                }
            }
            case TUPLE -> {
                sb.append('(');
                renderAll(node.elements(), LAMBDA);
                if (node.elements().size() == 1)
                    sb.append(',');
                sb.append(')');
            }
        }
        return null;
    }

    @Override
    public @Nullable Void visitDict(DictTree node, Integer minPrecedence) {
        sb.append('{');
        for (int i = 0; i < node.values().size(); i++) {
            if (i > 0)
                sb.append(", ");

            final ExpressionTree key = node.keys().get(i);
            if (key == null) {
                sb.append("**");
                render(node.values().get(i), BIT_OR);
            } else {
                render(key, LAMBDA);
                sb.append(": ");
                render(node.values().get(i), LAMBDA);
            }
        }
        sb.append('}');
        return null;
    }

    @Override
    public @Nullable Void visitComprehensionExpression(ComprehensionExpressionTree node, Integer minPrecedence) {
        final String[] brackets = switch (node.type()) {
            case GENERATOR -> new String[]{"(", ")"};
            case LIST -> new String[]{"[", "]"};
            case SET, DICT -> new String[]{"{", "}"};
        };
        sb.append(brackets[0]);
        renderComprehensionBody(node);
        sb.append(brackets[1]);
        return null;
    }

    private void renderComprehensionBody(ComprehensionExpressionTree node) {
        render(node.element(), LAMBDA);
        if (node.value() != null) {
            sb.append(": ");
            render(node.value(), LAMBDA);
        }
        for (ComprehensionTree generator : node.generators()) {
            sb.append(' ');
            render(generator, LAMBDA);
        }
    }

    @Override
    public @Nullable Void visitComprehension(ComprehensionTree node, Integer minPrecedence) {
        sb.append("for ");
        if (node.target() instanceof CollectionLiteralTree tuple
                && tuple.type() == CollectionLiteralTree.Type.TUPLE
                && !tuple.elements().isEmpty()) {
            renderAll(tuple.elements(), BIT_OR);
            if (tuple.elements().size() == 1)
                sb.append(',');
        } else {
            render(node.target(), BIT_OR);
        }
        sb.append(" in ");
        render(node.iterator(), OR);
        for (ExpressionTree condition : node.conditions()) {
            sb.append(" if ");
            render(condition, OR);
        }
        return null;
    }

    /**
     * Renders a constant the way the predicate language writes it.
     *
     * @param value a literal value, as held by {@link LiteralTree}
     * @return its source form
     */
    public static String literal(@Nullable Object value) {
        if (value == null)
            return "None";
        if (value instanceof Boolean b)
            return b ? "True" : "False";
        if (value instanceof Double d)
            return floatLiteral(d);
        if (value instanceof Number n)
            return n.toString();
        if (value instanceof String s)
            return stringLiteral(s);
        throw new IllegalArgumentException("Not a literal value: " + value.getClass().getName());
    }

    private static String floatLiteral(double d) {
        if (Double.isNaN(d))
            return "float('nan')";
        if (Double.isInfinite(d))
            return d > 0 ? "1e999" : "-1e999";

        final double abs = Math.abs(d);
        if (abs == 0 || (abs >= 1e-4 && abs < 1e16)) {
            final String plain = BigDecimal.valueOf(d).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        // Double.toString always uses the E notation for these magnitudes
        return Double.toString(d).replace("E", "e");
    }

    private static String stringLiteral(String s) {
        final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        final StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote)
                        sb.append('\\').append(c);
                    else if (c < 0x20 || c == 0x7f)
                        sb.append(String.format("\\x%02x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }
}
