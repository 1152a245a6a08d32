package it.polimi.ds.ruleir.ir;

import java.util.List;

public record StateMethodNode(String method, List<RuleNode> args) implements RuleNode {

    public StateMethodNode {
        args = List.copyOf(args);
    }

    @Override
    public Type getType() {
        return Type.STATE_METHOD;
    }
}
