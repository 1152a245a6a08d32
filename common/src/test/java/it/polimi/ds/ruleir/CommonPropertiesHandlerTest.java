package it.polimi.ds.ruleir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommonPropertiesHandlerTest {

    @TempDir
    Path tempDir;

    @Test
    void fileWinsOverEnvironment() throws IOException {
        final Path file = tempDir.resolve("test.properties");
        Files.writeString(file, "DEFAULT_PLAYER=4\n", StandardCharsets.UTF_8);

        var props = new CommonPropertiesHandler(file, Map.of("RULEIR_DEFAULT_PLAYER", "7")::get);
        assertEquals(4, props.getDefaultPlayer());
    }

    @Test
    void environmentIsPrefixed() throws IOException {
        var props = new CommonPropertiesHandler(
                tempDir.resolve("missing.properties"),
                Map.of("RULEIR_DEFAULT_PLAYER", "7", "DEFAULT_PLAYER", "9")::get);
        assertEquals(7, props.getDefaultPlayer());
    }

    @Test
    void systemPropertiesAreCamelCase() throws IOException {
        System.setProperty("defaultPlayer", "5");
        try {
            var props = new CommonPropertiesHandler(
                    tempDir.resolve("missing.properties"),
                    Map.of("RULEIR_DEFAULT_PLAYER", "7")::get);
            assertEquals(5, props.getDefaultPlayer());
        } finally {
            System.clearProperty("defaultPlayer");
        }
    }

    @Test
    void defaults() throws IOException {
        var props = new CommonPropertiesHandler(tempDir.resolve("missing.properties"), name -> null);
        assertEquals(1, props.getDefaultPlayer());
        assertEquals("", props.getProperty("SOMETHING_ELSE"));
    }

    @Test
    void invalidInteger() throws IOException {
        var props = new CommonPropertiesHandler(tempDir.resolve("missing.properties"),
                Map.of("RULEIR_DEFAULT_PLAYER", "one")::get);
        assertThrows(IllegalStateException.class, props::getDefaultPlayer);
    }
}
