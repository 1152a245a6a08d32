package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The failure envelope. It carries the logs accumulated while the analysis was attempted, the normalized source
 * when parsing it failed, and the stack trace of unexpected failures.
 */
public record ErrorNode(String message,
                        ErrorSubtype subtype,
                        List<String> debugLog,
                        List<ErrorLogEntry> errorLog,
                        @Nullable String cleanedSource,
                        @Nullable String traceback) implements RuleNode {

    public ErrorNode {
        debugLog = List.copyOf(debugLog);
        errorLog = List.copyOf(errorLog);
    }

    public ErrorNode(String message, ErrorSubtype subtype, List<String> debugLog, List<ErrorLogEntry> errorLog) {
        this(message, subtype, debugLog, errorLog, null, null);
    }

    @Override
    public Type getType() {
        return Type.ERROR;
    }
}
