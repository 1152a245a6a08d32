package it.polimi.ds.ruleir.ir;

import java.util.List;

public record FunctionCallNode(RuleNode function, List<RuleNode> args) implements RuleNode {

    public FunctionCallNode {
        args = List.copyOf(args);
    }

    @Override
    public Type getType() {
        return Type.FUNCTION_CALL;
    }
}
