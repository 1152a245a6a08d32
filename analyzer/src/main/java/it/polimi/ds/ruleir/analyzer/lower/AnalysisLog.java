package it.polimi.ds.ruleir.analyzer.lower;

import it.polimi.ds.ruleir.ir.ErrorLogEntry;
import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Debug and error entries of a single analysis. Every entry is also sent to SLF4J.
 */
public final class AnalysisLog {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisLog.class);

    private final List<String> debugLog = new ArrayList<>();
    private final List<ErrorLogEntry> errorLog = new ArrayList<>();

    public void debug(String format, @Nullable Object... args) {
        final String message = MessageFormatter.arrayFormat(format, args).getMessage();
        LOGGER.debug(message);
        debugLog.add(message);
    }

    public void error(String message) {
        error(message, null);
    }

    public void error(String message, @Nullable Throwable cause) {
        if (cause != null)
            LOGGER.warn(message, cause);
        else
            LOGGER.warn(message);
        errorLog.add(new ErrorLogEntry(message, cause != null ? stackTrace(cause) : null));
    }

    public boolean hasErrors() {
        return !errorLog.isEmpty();
    }

    public @Unmodifiable List<String> debugLog() {
        return List.copyOf(debugLog);
    }

    public @Unmodifiable List<ErrorLogEntry> errorLog() {
        return List.copyOf(errorLog);
    }

    public static String stackTrace(Throwable t) {
        final StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            t.printStackTrace(pw);
        }
        return sw.toString();
    }
}
