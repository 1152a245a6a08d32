package it.polimi.ds.ruleir.tree;

import java.util.List;

public record ModuleTree(List<StatementTree> body, Span span) implements Tree {

    public ModuleTree {
        body = List.copyOf(body);
    }

    @Override
    public Kind getKind() {
        return Kind.MODULE;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitModule(this, p);
    }
}
