package it.polimi.ds.ruleir.src;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkDirFileLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsWithoutBom() throws IOException {
        Files.writeString(tempDir.resolve("rules.py"), "\uFEFFset_rule(a, b)\n", StandardCharsets.UTF_8);

        final WorkDirFileLoader fileLoader = new WorkDirFileLoader(tempDir);
        assertTrue(fileLoader.resourceExists("rules.py"));
        assertFalse(fileLoader.resourceExists("missing.py"));
        assertEquals("set_rule(a, b)\n", fileLoader.loadSource("rules.py"));
    }

    @Test
    void rejectsTraversal() {
        final WorkDirFileLoader fileLoader = new WorkDirFileLoader(tempDir.resolve("inner"));
        assertThrows(IllegalStateException.class, () -> fileLoader.resolvePath("../outside.py"));
        assertEquals(tempDir.resolve("inner").resolve("a.py").toAbsolutePath().normalize(),
                fileLoader.resolvePath("sub/../a.py"));
    }
}
