package tcl.callgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tcl.callgraph.scan.ProcedureScanner;
import tcl.callgraph.scan.SourceFileFinder;

public class GraphBuilderTest {

    @Test
    void malformedFileIsSkippedAndBuildContinues(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("a_broken.tcl"), "proc broken {} {\n  never closed\n");
        Files.writeString(dir.resolve("b_good.tcl"), "proc a {} { b; c }\n");
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("nested/c_more.tcl"), "proc b {} { c }\n");

        final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        final GraphBuilder builder = new GraphBuilder(
                new SourceFileFinder(q -> false, err), new ProcedureScanner(), err);

        final BuildResult result = builder.build(List.of(dir));

        assertEquals(2, result.stats().filesParsed());
        assertEquals(1, result.stats().filesSkipped());
        assertEquals(List.of("b", "c"), result.index().calls().get("a"));
        assertEquals(List.of("a", "b"), result.index().callers().get("c"));
        assertFalse(result.index().isDeclared("broken"));

        final String log = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("WARN: skipping"), log);
        assertTrue(log.contains("a_broken.tcl"), log);
    }
}
