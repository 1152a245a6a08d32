/**
 * The rule IR: the portable tree a predicate is lowered into.
 * <p>
 * Every node is an immutable record implementing {@link it.polimi.ds.ruleir.ir.RuleNode} and is tagged on the wire
 * by its {@link it.polimi.ds.ruleir.ir.RuleNode.Type#jsonName()}. Consumers are expected to evaluate the tree
 * against their own game state, the analyzer never does.
 */
@NullMarked
package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.NullMarked;
