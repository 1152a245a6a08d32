package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

/**
 * Both the ternary expression and the {@code if} statement. A missing {@code else} branch is a {@code null}
 * {@code ifFalse}, it is never defaulted to a boolean.
 */
public record ConditionalNode(RuleNode test, RuleNode ifTrue, @Nullable RuleNode ifFalse) implements RuleNode {

    @Override
    public Type getType() {
        return Type.CONDITIONAL;
    }
}
