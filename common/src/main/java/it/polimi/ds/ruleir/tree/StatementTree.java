package it.polimi.ds.ruleir.tree;

public interface StatementTree extends Tree {
}
