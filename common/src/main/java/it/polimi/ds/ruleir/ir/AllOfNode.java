package it.polimi.ds.ruleir.ir;

/**
 * An {@code all(...)} over a generator that could not be expanded at analysis time.
 */
public record AllOfNode(RuleNode elementRule, ComprehensionDetailsNode iteratorInfo) implements RuleNode {

    @Override
    public Type getType() {
        return Type.ALL_OF;
    }
}
