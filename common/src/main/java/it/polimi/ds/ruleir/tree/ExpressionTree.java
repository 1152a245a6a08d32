package it.polimi.ds.ruleir.tree;

public interface ExpressionTree extends Tree {
}
