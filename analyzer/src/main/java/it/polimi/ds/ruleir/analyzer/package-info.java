/**
 * Lowers predicate functions into the rule IR.
 * <p>
 * {@link it.polimi.ds.ruleir.analyzer.RuleAnalyzer} is the entry point: it turns an
 * {@link it.polimi.ds.ruleir.analyzer.AnalysisRequest} into an {@link it.polimi.ds.ruleir.analyzer.AnalysisResult},
 * never throwing. Failures are reported as {@link it.polimi.ds.ruleir.ir.ErrorNode}s.
 */
@NullMarked
package it.polimi.ds.ruleir.analyzer;

import org.jspecify.annotations.NullMarked;
