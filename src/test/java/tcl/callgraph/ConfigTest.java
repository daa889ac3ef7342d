package tcl.callgraph;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import tcl.callgraph.Config.Mode;
import tcl.callgraph.Config.ProcedureQuery;

public class ConfigTest {

    private static final Path WORK = Paths.get("/work").toAbsolutePath();

    private static Config parse(String... args) throws Config.UsageException {
        return Config.parse(List.of(args), Map.of(), WORK);
    }

    @Test
    void noArgumentsMeansInteractive() throws Exception {
        final Config cfg = parse();

        assertEquals(Mode.INTERACTIVE, cfg.mode());
        assertEquals(Config.DEFAULT_MAX_DEPTH, cfg.maxDepth());
        assertEquals(Config.OutputFormat.TEXT, cfg.format());
        assertEquals(WORK.resolve(".dcgraph/index.cbor").normalize(), cfg.indexFile());
    }

    @Test
    void buildCollectsEveryInput() throws Exception {
        final Config cfg = parse("-b", "lib", "main.tcl");

        assertEquals(Mode.BUILD, cfg.mode());
        assertEquals(List.of(Paths.get("lib"), Paths.get("main.tcl")), cfg.buildInputs());
    }

    @Test
    void leadingDependencyFlagAppliesToAllNames() throws Exception {
        final Config cfg = parse("-d", "-f", "a", "b");

        assertEquals(Mode.QUERY, cfg.mode());
        assertEquals(List.of(new ProcedureQuery("a", true), new ProcedureQuery("b", true)), cfg.queries());
    }

    @Test
    void trailingDependencyFlagAppliesToPrecedingName() throws Exception {
        final Config cfg = parse("-f", "a", "-d", "b");

        assertEquals(List.of(new ProcedureQuery("a", true), new ProcedureQuery("b", false)), cfg.queries());
    }

    @Test
    void maxDepthAcceptsBothForms() throws Exception {
        assertEquals(3, parse("-f", "a", "--max-depth", "3").maxDepth());
        assertEquals(7, parse("--max-depth=7", "-f", "a").maxDepth());
    }

    @Test
    void maxDepthMustBePositive() {
        assertThrows(Config.UsageException.class, () -> parse("-f", "a", "--max-depth", "0"));
        assertThrows(Config.UsageException.class, () -> parse("-f", "a", "--max-depth=-2"));
        assertThrows(Config.UsageException.class, () -> parse("-f", "a", "--max-depth", "many"));
        assertThrows(Config.UsageException.class, () -> parse("-f", "a", "--max-depth"));
    }

    @Test
    void emptyBuildOrQueryListIsRejected() {
        assertThrows(Config.UsageException.class, () -> parse("-b"));
        assertThrows(Config.UsageException.class, () -> parse("-f", "--max-depth=2"));
    }

    @Test
    void unknownOptionsAndStrayArgumentsAreRejected() {
        var unknown = assertThrows(Config.UsageException.class, () -> parse("-x"));
        assertTrue(unknown.getMessage().contains("Unknown option"), unknown.getMessage());

        var stray = assertThrows(Config.UsageException.class, () -> parse("stray"));
        assertTrue(stray.getMessage().contains("Unexpected argument"), stray.getMessage());
    }

    @Test
    void deleteIndexWinsOverOtherOptions() throws Exception {
        assertEquals(Mode.DELETE_INDEX, parse("-b", "src", "--delete-index", "-f", "a").mode());
    }

    @Test
    void helpIsRecognised() throws Exception {
        assertEquals(Mode.HELP, parse("-h").mode());
        assertEquals(Mode.HELP, parse("-f", "a", "--help").mode());
    }

    @Test
    void indexArgumentBeatsEnvironment() throws Exception {
        final Map<String, String> env = Map.of(Config.INDEX_ENV, "from-env.cbor");

        assertEquals(WORK.resolve("from-env.cbor"), Config.parse(List.of(), env, WORK).indexFile());
        assertEquals(WORK.resolve("arg.cbor"),
                Config.parse(List.of("--index=arg.cbor"), env, WORK).indexFile());
    }

    @Test
    void formatOption() throws Exception {
        assertEquals(Config.OutputFormat.JSON, parse("--format=json", "-f", "a").format());
        assertThrows(Config.UsageException.class, () -> parse("--format=xml"));
    }
}
