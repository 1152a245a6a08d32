package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Generator expression or list/set/dict comprehension.
 *
 * @param type which brackets delimit it
 * @param element the produced element (the key, for dict comprehensions)
 * @param value the produced value for dict comprehensions, null otherwise
 * @param generators the {@code for} clauses, outermost first
 * @param span location
 */
public record ComprehensionExpressionTree(Type type,
                                          ExpressionTree element,
                                          @Nullable ExpressionTree value,
                                          List<ComprehensionTree> generators,
                                          Span span) implements ExpressionTree {

    public enum Type { GENERATOR, LIST, SET, DICT }

    public ComprehensionExpressionTree {
        generators = List.copyOf(generators);
    }

    @Override
    public Kind getKind() {
        return Kind.COMPREHENSION_EXPRESSION;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitComprehensionExpression(this, p);
    }
}
