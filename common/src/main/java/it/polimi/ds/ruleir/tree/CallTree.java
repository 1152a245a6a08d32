package it.polimi.ds.ruleir.tree;

import java.util.List;

/**
 * A call. Positional arguments (including {@link StarredTree} ones) are kept apart from keyword arguments.
 */
public record CallTree(ExpressionTree function,
                       List<ExpressionTree> arguments,
                       List<KeywordTree> keywords,
                       Span span) implements ExpressionTree {

    public CallTree {
        arguments = List.copyOf(arguments);
        keywords = List.copyOf(keywords);
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitCall(this, p);
    }
}
