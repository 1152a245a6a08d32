package it.polimi.ds.ruleir.analyzer.properties;

import it.polimi.ds.ruleir.PropertiesHandler;
import org.jetbrains.annotations.Unmodifiable;

import java.util.Set;

public interface AnalyzerPropertiesHandler extends PropertiesHandler {

    int getRecursionLimit();

    /**
     * @return names of module globals that are visible to the analyzed functions
     */
    @Unmodifiable Set<String> getGlobalWhitelist();
}
