package tcl.callgraph.scan;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SourceFileFinderTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    private final List<String> questions = new ArrayList<>();

    @BeforeEach
    void createTree() throws Exception {
        Files.createDirectories(dir.resolve("src/sub"));
        Files.createDirectories(dir.resolve("src/.git"));
        Files.writeString(dir.resolve("src/b.tcl"), "b\n");
        Files.writeString(dir.resolve("src/a.tcl"), "a\n");
        Files.writeString(dir.resolve("src/sub/c.tcl"), "c\n");
        Files.writeString(dir.resolve("src/readme.txt"), "not tcl\n");
        Files.writeString(dir.resolve("src/.git/hook.tcl"), "hidden\n");
    }

    private SourceFileFinder finder(boolean answer) {
        return new SourceFileFinder(q -> {
            questions.add(q);
            return answer;
        }, err);
    }

    @Test
    void walksDirectoriesRecursivelyInPathOrder() throws Exception {
        var files = finder(false).findSourceFiles(List.of(dir.resolve("src")));

        assertEquals(List.of(dir.resolve("src/a.tcl"), dir.resolve("src/b.tcl"), dir.resolve("src/sub/c.tcl")), files);
        assertTrue(questions.isEmpty());
    }

    @Test
    void nonTclFilesAreSkippedSilently() throws Exception {
        var files = finder(false).findSourceFiles(List.of(dir.resolve("src/readme.txt"), dir.resolve("src/a.tcl")));

        assertEquals(List.of(dir.resolve("src/a.tcl")), files);
        assertTrue(questions.isEmpty());
        assertEquals("", errBytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void fileWithoutExtensionIsTakenAsTcl() throws Exception {
        final Path script = dir.resolve("runme");
        Files.writeString(script, "go\n");

        assertEquals(List.of(script), finder(false).findSourceFiles(List.of(script)));
    }

    @Test
    void missingInputIsSkippedWhenConfirmed() throws Exception {
        var files = finder(true).findSourceFiles(List.of(dir.resolve("missing.tcl"), dir.resolve("src/a.tcl")));

        assertEquals(List.of(dir.resolve("src/a.tcl")), files);
        assertEquals(1, questions.size());
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("missing.tcl"));
    }

    @Test
    void missingInputAbortsByDefault() {
        assertThrows(BuildAbortedException.class,
                () -> finder(false).findSourceFiles(List.of(dir.resolve("missing.tcl"))));
        assertEquals(1, questions.size());
    }
}
