package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.analyzer.fn.SourcePredicate;
import it.polimi.ds.ruleir.ir.ErrorNode;
import it.polimi.ds.ruleir.ir.JacksonRuleSerde;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RuleAnalyzerRobustnessTest {

    static final List<String> FRAGMENTS = List.of(
            "def rule(state):",
            "    return state.has('A', player)",
            "    if flag:",
            "        return True",
            "lambda state: (state.has('A', player) or",
            "    state.has('B', player))",
            "lambda state: state.has_any(['A', 'B'], player)",
            "    # just a comment",
            "x = staticmethod(lambda state: True)",
            "    return {'a': 1}",
            "for item in items:",
            "\tpass",
            "return",
            "'''docstring'''",
            ")",
            "(",
            "@decorator",
            "lambda: len([1, 2, 3])",
            "    return all(state.has(i, player) for i in items)",
            "",
            "    ",
            "\"unterminated",
            "lambda state, n=3: state.has('Arrow', player, n) and not flag");

    @TempDir
    Path tempDir;

    @Test
    void randomSourcesNeverEscape() throws IOException {
        final Path file = tempDir.resolve("rules.py");
        Files.writeString(file, "VALUE = 1\nOTHER = [1, 2]\n", StandardCharsets.UTF_8);

        final RuleAnalyzer analyzer = new RuleAnalyzer();
        final JacksonRuleSerde serde = new JacksonRuleSerde();
        final Random random = new Random(42);

        for (int i = 0; i < 100; i++) {
            final int lines = 1 + random.nextInt(6);
            final List<String> text = new ArrayList<>(lines);
            for (int j = 0; j < lines; j++)
                text.add(FRAGMENTS.get(random.nextInt(FRAGMENTS.size())));
            final String source = String.join("\n", text);

            var fn = SourcePredicate.builder("rule_" + i)
                    .file(file, 1 + random.nextInt(5))
                    .source(source)
                    .build();

            var result = assertDoesNotThrow(() -> analyzer.analyze(fn), source);
            assertNotNull(result.node(), source);
            assertEquals(result.node() instanceof ErrorNode, result.isError(), source);
            assertDoesNotThrow(() -> serde.jsonify(result.node()), source);
        }
    }
}
