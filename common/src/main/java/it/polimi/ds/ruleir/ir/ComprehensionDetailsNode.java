package it.polimi.ds.ruleir.ir;

public record ComprehensionDetailsNode(RuleNode target, RuleNode iterator) implements RuleNode {

    @Override
    public Type getType() {
        return Type.COMPREHENSION_DETAILS;
    }
}
