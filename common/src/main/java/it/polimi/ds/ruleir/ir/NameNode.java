package it.polimi.ds.ruleir.ir;

public record NameNode(String name) implements RuleNode {

    @Override
    public Type getType() {
        return Type.NAME;
    }
}
