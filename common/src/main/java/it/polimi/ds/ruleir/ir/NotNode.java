package it.polimi.ds.ruleir.ir;

public record NotNode(RuleNode condition) implements RuleNode {

    @Override
    public Type getType() {
        return Type.NOT;
    }
}
