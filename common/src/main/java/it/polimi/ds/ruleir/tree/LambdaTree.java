package it.polimi.ds.ruleir.tree;

import java.util.List;

public record LambdaTree(List<ParameterTree> parameters, ExpressionTree body, Span span) implements ExpressionTree {

    public LambdaTree {
        parameters = List.copyOf(parameters);
    }

    @Override
    public Kind getKind() {
        return Kind.LAMBDA;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitLambda(this, p);
    }
}
