/**
 * Syntax tree of the predicate language.
 * <p>
 * Every node is an immutable record implementing {@link it.polimi.ds.ruleir.tree.Tree}. Statements implement
 * {@link it.polimi.ds.ruleir.tree.StatementTree}, expressions implement
 * {@link it.polimi.ds.ruleir.tree.ExpressionTree}, and nodes are walked through a
 * {@link it.polimi.ds.ruleir.tree.TreeVisitor}.
 */
@NullMarked
package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.NullMarked;
