package it.polimi.ds.ruleir.analyzer.source;

import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import it.polimi.ds.ruleir.script.TreeRenderer;
import it.polimi.ds.ruleir.tree.LambdaTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public final class SourceLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceLocator.class);

    private final SourceCache cache;

    public SourceLocator() {
        this(SourceCache.shared());
    }

    public SourceLocator(SourceCache cache) {
        this.cache = cache;
    }

    /**
     * Looks for the lambda declared at the function's start line in its file, and renders it back to text. When
     * that is not possible, the declared source text of the function is used instead.
     *
     * @return the source, or a failure if there is none at all
     */
    public SourceLookup locate(PredicateFunction fn) {
        final Path file = fn.file();
        if (file != null) {
            try {
                final LambdaTree lambda = LambdaLineFinder.find(cache.get(file).tree(), fn.startLine());
                if (lambda != null)
                    return SourceLookup.found(TreeRenderer.render(lambda));
                LOGGER.debug("No lambda at {}:{} for {}, falling back to its declared source",
                        file, fn.startLine(), fn.name());
            } catch (IOException | ScriptSyntaxException | RuntimeException ex) {
                LOGGER.debug("Failed to look {} up in {}, falling back to its declared source", fn.name(), file, ex);
            }
        }

        final String sourceText = fn.sourceText();
        if (sourceText != null)
            return SourceLookup.found(sourceText);
        return SourceLookup.failed("No source available for " + fn.name());
    }
}
