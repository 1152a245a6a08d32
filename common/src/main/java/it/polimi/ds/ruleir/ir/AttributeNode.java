package it.polimi.ds.ruleir.ir;

public record AttributeNode(RuleNode object, String attr) implements RuleNode {

    @Override
    public Type getType() {
        return Type.ATTRIBUTE;
    }
}
