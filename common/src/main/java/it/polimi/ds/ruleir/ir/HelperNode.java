package it.polimi.ds.ruleir.ir;

import java.util.List;

/**
 * A call to a helper that was kept as is, either because it could not be inlined or because it was asked to.
 */
public record HelperNode(String name, List<RuleNode> args) implements RuleNode {

    public HelperNode {
        args = List.copyOf(args);
    }

    @Override
    public Type getType() {
        return Type.HELPER;
    }
}
