package it.polimi.ds.ruleir.analyzer.properties;

import it.polimi.ds.ruleir.CommonPropertiesHandler;
import it.polimi.ds.ruleir.analyzer.RecursionGuard;
import it.polimi.ds.ruleir.src.WorkDirFileLoader;
import org.jetbrains.annotations.Unmodifiable;
import org.jetbrains.annotations.VisibleForTesting;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

public class AnalyzerPropertiesHandlerImpl extends CommonPropertiesHandler implements AnalyzerPropertiesHandler {

    private static final String DEFAULT_PROPERTIES_FILE_NAME = "analyzer.properties";

    public AnalyzerPropertiesHandlerImpl(WorkDirFileLoader fileLoader) throws IOException {
        super(fileLoader.resolvePath(DEFAULT_PROPERTIES_FILE_NAME));
    }

    @VisibleForTesting
    AnalyzerPropertiesHandlerImpl(Path propertiesFile, UnaryOperator<@Nullable String> envLookup) throws IOException {
        super(propertiesFile, envLookup);
    }

    @Override
    public int getRecursionLimit() {
        final int limit = getIntProperty("RECURSION_LIMIT", RecursionGuard.DEFAULT_LIMIT);
        if (limit < 1)
            throw new IllegalStateException("RECURSION_LIMIT must be at least 1, got " + limit);
        return limit;
    }

    @Override
    public @Unmodifiable Set<String> getGlobalWhitelist() {
        return Arrays.stream(getProperty("GLOBAL_WHITELIST").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
