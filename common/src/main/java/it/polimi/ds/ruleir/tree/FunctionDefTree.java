package it.polimi.ds.ruleir.tree;

import java.util.List;

public record FunctionDefTree(String name,
                              List<ParameterTree> parameters,
                              List<StatementTree> body,
                              Span span) implements StatementTree {

    public FunctionDefTree {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION_DEF;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitFunctionDef(this, p);
    }
}
