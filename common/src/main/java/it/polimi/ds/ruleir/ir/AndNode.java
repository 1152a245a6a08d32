package it.polimi.ds.ruleir.ir;

import java.util.List;

public record AndNode(List<RuleNode> conditions) implements RuleNode {

    public AndNode {
        conditions = List.copyOf(conditions);
    }

    @Override
    public Type getType() {
        return Type.AND;
    }
}
