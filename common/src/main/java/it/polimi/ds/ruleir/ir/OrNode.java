package it.polimi.ds.ruleir.ir;

import java.util.List;

public record OrNode(List<RuleNode> conditions) implements RuleNode {

    public OrNode {
        conditions = List.copyOf(conditions);
    }

    @Override
    public Type getType() {
        return Type.OR;
    }
}
