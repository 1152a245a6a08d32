/**
 * Front end of the predicate language: tokenizer, recursive-descent parser and the renderer printing trees back to
 * source text.
 */
@NullMarked
package it.polimi.ds.ruleir.script;

import org.jspecify.annotations.NullMarked;
