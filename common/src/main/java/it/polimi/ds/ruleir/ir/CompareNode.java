package it.polimi.ds.ruleir.ir;

/**
 * A single comparison. {@code op} is one of {@code == != < <= > >= is "is not" in "not in"}.
 */
public record CompareNode(RuleNode left, String op, RuleNode right) implements RuleNode {

    @Override
    public Type getType() {
        return Type.COMPARE;
    }
}
