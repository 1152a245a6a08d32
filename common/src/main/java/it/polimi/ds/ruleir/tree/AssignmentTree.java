package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Plain ({@code a = b = value}), annotated ({@code a: T = value}) or augmented ({@code a += value}) assignment.
 *
 * @param targets assignment targets, left to right
 * @param augmentedOperator the operator of an augmented assignment, null otherwise
 * @param value the assigned value
 * @param span location
 */
public record AssignmentTree(List<ExpressionTree> targets,
                             BinaryTree.@Nullable Operator augmentedOperator,
                             ExpressionTree value,
                             Span span) implements StatementTree {

    public AssignmentTree {
        targets = List.copyOf(targets);
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGNMENT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitAssignment(this, p);
    }
}
