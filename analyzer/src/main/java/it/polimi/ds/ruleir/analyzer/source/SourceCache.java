package it.polimi.ds.ruleir.analyzer.source;

import it.polimi.ds.ruleir.script.ScriptParser;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import it.polimi.ds.ruleir.src.WorkDirFileLoader;
import it.polimi.ds.ruleir.tree.ModuleTree;
import it.polimi.ds.ruleir.utils.SuppressFBWarnings;
import org.jetbrains.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Text and parse tree of the files predicates are declared in.
 * <p>
 * Each file is read and parsed at most once, and entries are never invalidated. A file that cannot be read or
 * parsed is not cached, so it is tried again on the next lookup.
 */
public final class SourceCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceCache.class);
    private static final SourceCache SHARED = new SourceCache();

    private final ConcurrentMap<Path, Entry> entries = new ConcurrentHashMap<>();

    public record Entry(Path file, String text, ModuleTree tree) {
    }

    public static SourceCache shared() {
        return SHARED;
    }

    @SuppressWarnings({
            "PMD.PreserveStackTrace", // Done on purpose to let checked exception through
    })
    @SuppressFBWarnings("LEST_LOST_EXCEPTION_STACK_TRACE") // Done on purpose to let checked exception through
    public Entry get(Path file) throws IOException, ScriptSyntaxException {
        try {
            return entries.computeIfAbsent(file.toAbsolutePath().normalize(), SourceCache::load);
        } catch (WrappedIOException ex) {
            throw ex.getCause();
        } catch (WrappedScriptSyntaxException ex) {
            throw ex.getCause();
        }
    }

    @VisibleForTesting
    boolean isCached(Path file) {
        return entries.containsKey(file.toAbsolutePath().normalize());
    }

    @SuppressFBWarnings("PATH_TRAVERSAL_IN") // Paths come from the embedding layer, not from users
    private static Entry load(Path file) {
        LOGGER.debug("Reading and parsing {}", file);
        final String text;
        try {
            text = WorkDirFileLoader.stripBom(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new WrappedIOException(ex);
        }

        try {
            return new Entry(file, text, ScriptParser.parse(text));
        } catch (ScriptSyntaxException ex) {
            throw new WrappedScriptSyntaxException(ex);
        }
    }
}
