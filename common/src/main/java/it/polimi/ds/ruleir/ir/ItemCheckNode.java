package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

public record ItemCheckNode(RuleNode item, @Nullable RuleNode count) implements RuleNode {

    public ItemCheckNode(RuleNode item) {
        this(item, null);
    }

    @Override
    public Type getType() {
        return Type.ITEM_CHECK;
    }
}
