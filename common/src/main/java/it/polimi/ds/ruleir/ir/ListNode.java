package it.polimi.ds.ruleir.ir;

import java.util.List;

public record ListNode(List<RuleNode> value) implements RuleNode {

    public ListNode {
        value = List.copyOf(value);
    }

    @Override
    public Type getType() {
        return Type.LIST;
    }
}
