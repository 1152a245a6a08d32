package it.polimi.ds.ruleir.analyzer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RuleAnalyzerMainTest {

    static final String RULES = """
            KEY_ITEMS = ["Hookshot", "Hammer"]


            def can_lift_rocks(state, player):
                return state.has("Power Glove", player)


            def set_rules(world, player):
                set_rule(world.get_location("Rock", player), lambda state: can_lift_rocks(state, player))
                set_rule(world.get_location("Keys", player), lambda state: state.has_all(KEY_ITEMS, player))
                set_rule(world.get_location("Broken", player), lambda state: {"a": 1})
            """;

    @TempDir
    Path tempDir;

    private Path writeRules() throws IOException {
        final Path file = tempDir.resolve("rules.py");
        Files.writeString(file, RULES, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void analyzeEveryRule() throws IOException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final int failures;
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            failures = RuleAnalyzerMain.analyzeFile(new RuleAnalyzer(), writeRules(), null, out);
        }

        final String output = bytes.toString(StandardCharsets.UTF_8);
        assertEquals(1, failures);
        assertTrue(output.contains("\"item_check\""), output);
        assertTrue(output.contains("\"Power Glove\""), output);
        assertTrue(output.contains("\"has_all\""), output);
        assertTrue(output.indexOf("\"Hammer\"") < output.indexOf("\"Hookshot\""), output);
        assertTrue(output.contains("\"visitation\""), output);
    }

    @Test
    void analyzeOneRule() throws IOException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final int failures;
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            failures = RuleAnalyzerMain.analyzeFile(new RuleAnalyzer(), writeRules(), "Rock", out);
        }

        final String output = bytes.toString(StandardCharsets.UTF_8);
        assertEquals(0, failures);
        assertTrue(output.contains("\"Power Glove\""), output);
        assertFalse(output.contains("\"has_all\""), output);
    }

    @Test
    void unparseableFile() throws IOException {
        final Path file = tempDir.resolve("broken.py");
        Files.writeString(file, "def broken(:\n", StandardCharsets.UTF_8);

        assertEquals(1, RuleAnalyzerMain.analyzeFile(new RuleAnalyzer(), file, null, System.out));
    }
}
