package it.polimi.ds.ruleir.analyzer.lower;

import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.ir.RuleNode;
import org.jspecify.annotations.Nullable;

@FunctionalInterface
public interface HelperInliner {

    /**
     * Analyzes a helper called by the function being lowered, sharing the caller's recursion guard.
     *
     * @param helper the called function
     * @param caller context of the call site
     * @return the helper's node, or null if its analysis failed
     */
    @Nullable RuleNode inline(PredicateFunction helper, RuleLoweringVisitor.Ctx caller);
}
