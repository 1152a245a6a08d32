package it.polimi.ds.ruleir.ir;

public record BinaryOpNode(RuleNode left, String op, RuleNode right) implements RuleNode {

    @Override
    public Type getType() {
        return Type.BINARY_OP;
    }
}
