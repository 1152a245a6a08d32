package it.polimi.ds.ruleir.ir;

public record GeneratorExpressionNode(RuleNode element, ComprehensionDetailsNode comprehension) implements RuleNode {

    @Override
    public Type getType() {
        return Type.GENERATOR_EXPRESSION;
    }
}
