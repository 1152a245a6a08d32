package it.polimi.ds.ruleir.ir;

public record SubscriptNode(RuleNode value, RuleNode index) implements RuleNode {

    @Override
    public Type getType() {
        return Type.SUBSCRIPT;
    }
}
