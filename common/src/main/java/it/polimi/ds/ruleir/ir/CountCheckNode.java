package it.polimi.ds.ruleir.ir;

public record CountCheckNode(RuleNode item, RuleNode count) implements RuleNode {

    @Override
    public Type getType() {
        return Type.COUNT_CHECK;
    }
}
