package it.polimi.ds.ruleir.analyzer.source;

import it.polimi.ds.ruleir.script.Lexer;
import it.polimi.ds.ruleir.script.ScriptParser;
import it.polimi.ds.ruleir.script.ScriptSyntaxException;
import it.polimi.ds.ruleir.tree.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the located source of a function into a module holding a single function definition.
 */
public final class SourceNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceNormalizer.class);

    public static final String FUNCTION_NAME = "__analyzed_func__";
    static final String ALWAYS_TRUE = "def " + FUNCTION_NAME + "(state):\n    return True";

    private static final Pattern LAMBDA = Pattern.compile("lambda(?:\\s+([^:]*)|\\s*):\\s*(.*)", Pattern.DOTALL);

    private SourceNormalizer() {
    }

    /**
     * Removes comments, then:
     * <ul>
     *     <li>a {@code staticmethod(lambda ...: True)} assignment becomes a function always returning {@code True},
     *     any other text mentioning {@code staticmethod(} is rejected</li>
     *     <li>a lambda becomes an equivalent function definition</li>
     *     <li>anything else is returned as is</li>
     * </ul>
     *
     * @return the normalized source, or null if it was rejected
     */
    public static @Nullable String normalize(String source) {
        final String text = Lexer.stripComments(dedent(source));
        if (text.contains("staticmethod("))
            return normalizeStaticMethod(text);

        final Matcher matcher = LAMBDA.matcher(text);
        if (!matcher.matches())
            return text;

        final String rawParams = matcher.group(1);
        final String params = rawParams != null ? rawParams.strip() : "";
        final String body = matcher.group(2).strip();
        return "def " + FUNCTION_NAME + "(" + params + "):\n    return (" + body + ")";
    }

    private static @Nullable String normalizeStaticMethod(String text) {
        final ModuleTree module;
        try {
            module = ScriptParser.parse(text);
        } catch (ScriptSyntaxException ex) {
            LOGGER.warn("Failed to parse staticmethod source {}: {}", text, ex.getMessage());
            return null;
        }

        if (module.body().size() == 1
                && module.body().get(0) instanceof AssignmentTree assignment
                && assignment.augmentedOperator() == null
                && assignment.value() instanceof CallTree call
                && call.function() instanceof NameTree callee
                && callee.name().equals("staticmethod")
                && call.arguments().size() == 1
                && call.arguments().get(0) instanceof LambdaTree lambda
                && lambda.body() instanceof LiteralTree literal
                && Boolean.TRUE.equals(literal.value()))
            return ALWAYS_TRUE;

        LOGGER.warn("staticmethod source does not wrap a lambda returning True: {}", text);
        return null;
    }

    static String dedent(String text) {
        final String[] lines = text.split("\n", -1);
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank())
                continue;
            int i = 0;
            while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t'))
                i++;
            indent = Math.min(indent, i);
        }

        if (indent == 0 || indent == Integer.MAX_VALUE)
            return text;

        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0)
                sb.append('\n');
            sb.append(lines[i].isBlank() ? "" : lines[i].substring(indent));
        }
        return sb.toString();
    }
}
