package it.polimi.ds.ruleir;

import org.jetbrains.annotations.VisibleForTesting;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

public class CommonPropertiesHandler implements PropertiesHandler {

    private static final String ENV_VAR_PREFIX = "RULEIR_";
    private static final Pattern SNAKE_CASE_SEPARATOR = Pattern.compile("_([a-z])");

    protected final Properties props;
    private final UnaryOperator<@Nullable String> envLookup;

    public CommonPropertiesHandler(Path defaultPropertiesFilePath) throws IOException {
        this(defaultPropertiesFilePath, System::getenv);
    }

    @VisibleForTesting
    protected CommonPropertiesHandler(Path defaultPropertiesFilePath,
                                      UnaryOperator<@Nullable String> envLookup) throws IOException {
        this.props = new Properties();
        this.envLookup = envLookup;

        try (Reader r = Files.newBufferedReader(defaultPropertiesFilePath, StandardCharsets.UTF_8)) {
            props.load(r);
        } catch (NoSuchFileException ex) {
            // File does not exist, stuff might still be loaded from system props or env vars
        }
    }

    protected String getProperty(String screamingSnakeCase) {
        final var camelCase = SNAKE_CASE_SEPARATOR
                .matcher(screamingSnakeCase.toLowerCase(Locale.ROOT))
                .replaceAll(m -> m.group(1).toUpperCase(Locale.ROOT));

        String prop;
        if ((prop = props.getProperty(screamingSnakeCase)) != null)
            return prop;

        if ((prop = System.getProperty(camelCase)) != null)
            return prop;

        if ((prop = envLookup.apply(ENV_VAR_PREFIX + screamingSnakeCase)) != null)
            return prop;

        return "";
    }

    protected int getIntProperty(String screamingSnakeCase, int defaultValue) {
        final String prop = getProperty(screamingSnakeCase).trim();
        if (prop.isEmpty())
            return defaultValue;

        try {
            return Integer.parseInt(prop);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Property " + screamingSnakeCase + " is not an integer: " + prop, ex);
        }
    }

    @Override
    public int getDefaultPlayer() {
        return getIntProperty("DEFAULT_PLAYER", 1);
    }
}
