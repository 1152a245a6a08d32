package it.polimi.ds.ruleir.ir;

public record GroupCheckNode(RuleNode group) implements RuleNode {

    @Override
    public Type getType() {
        return Type.GROUP_CHECK;
    }
}
