package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.ir.ErrorLogEntry;
import it.polimi.ds.ruleir.ir.ErrorNode;
import it.polimi.ds.ruleir.ir.RuleNode;

import java.util.List;

/**
 * Outcome of an analysis: the lowered node, or an {@link ErrorNode}, with the logs collected along the way.
 */
public record AnalysisResult(RuleNode node, List<String> debugLog, List<ErrorLogEntry> errorLog) {

    public AnalysisResult {
        debugLog = List.copyOf(debugLog);
        errorLog = List.copyOf(errorLog);
    }

    public boolean isError() {
        return node instanceof ErrorNode;
    }
}
