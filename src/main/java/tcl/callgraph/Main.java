package tcl.callgraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import tcl.callgraph.graph.BuildResult;
import tcl.callgraph.graph.CallIndex;
import tcl.callgraph.graph.GraphBuilder;
import tcl.callgraph.io.IndexStore;
import tcl.callgraph.io.IndexStoreException;
import tcl.callgraph.query.JsonRenderer;
import tcl.callgraph.query.QueryEngine;
import tcl.callgraph.query.QueryPrinter;
import tcl.callgraph.query.ResultRenderer;
import tcl.callgraph.query.TextRenderer;
import tcl.callgraph.scan.BuildAbortedException;
import tcl.callgraph.scan.Confirmer;
import tcl.callgraph.scan.ProcedureScanner;
import tcl.callgraph.scan.SourceFileFinder;

public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args, System.in, System.out, System.err, System.getenv(), Paths.get(""));
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args,
                   InputStream stdin,
                   PrintStream out,
                   PrintStream err,
                   Map<String, String> env,
                   Path workDir) {
        final Config cfg;
        try {
            cfg = Config.parse(Arrays.asList(args), env, workDir.toAbsolutePath());
        } catch (Config.UsageException ex) {
            err.println("ERROR: " + ex.getMessage());
            err.println("Please run \"dcgraph -h\" or \"dcgraph --help\" for more information.");
            return EXIT_USAGE;
        }

        final BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        final IndexStore store = new IndexStore(cfg.indexFile());

        try {
            switch (cfg.mode()) {
                case HELP -> {
                    printUsage(out);
                    return EXIT_OK;
                }
                case DELETE_INDEX -> {
                    // a missing index is not an error
                    if (store.delete()) {
                        err.println("Deleted index file: " + store.file());
                    }
                    return EXIT_OK;
                }
                case BUILD -> {
                    if (!cfg.queries().isEmpty()) {
                        err.println("WARN: -f is ignored while building the index");
                    }
                    return build(cfg, store, in, err);
                }
                default -> {
                    return query(cfg, store, in, out, err);
                }
            }
        } catch (BuildAbortedException ex) {
            err.println("ERROR: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IndexStoreException ex) {
            err.println("ERROR: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return EXIT_FAILURE;
        } catch (Exception ex) {
            err.println("ERROR: failed to run " + cfg.mode().name().toLowerCase(Locale.ROOT) + ": "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return EXIT_FAILURE;
        }
    }

    private static int build(Config cfg, IndexStore store, BufferedReader in, PrintStream err)
            throws IOException, BuildAbortedException {
        err.println("Parsing tcl files...");
        final long started = System.nanoTime();

        final SourceFileFinder finder = new SourceFileFinder(Confirmer.console(in, err), err);
        final GraphBuilder builder = new GraphBuilder(finder, new ProcedureScanner(), err);
        final BuildResult result = builder.build(cfg.buildInputs());

        final long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        err.println("Parsed tcl files in " + millis + " ms");
        err.println("Number of TCL files parsed: " + result.stats().filesParsed());
        if (result.stats().filesSkipped() > 0) {
            err.println("WARN: files skipped: " + result.stats().filesSkipped());
        }

        err.println("Building and writing index...");
        final Path written = store.write(result.index());
        err.println("Index written to: " + written);
        err.println("Procedures: " + result.stats().procedures()
                + ", call edges: " + result.stats().callEdges());
        return EXIT_OK;
    }

    private static int query(Config cfg, IndexStore store, BufferedReader in, PrintStream out, PrintStream err)
            throws IOException {
        err.println("Reading index...");
        final CallIndex index = store.read();

        final ResultRenderer renderer = cfg.format() == Config.OutputFormat.JSON
                ? new JsonRenderer(out)
                : new TextRenderer(out);
        final QueryPrinter printer = new QueryPrinter(new QueryEngine(index), renderer, err);

        if (cfg.mode() == Config.Mode.QUERY) {
            for (Config.ProcedureQuery q : cfg.queries()) {
                if (q.dependencies()) {
                    printer.printDependencies(q.name());
                } else {
                    printer.printCallSequence(q.name(), cfg.maxDepth());
                }
            }
            return EXIT_OK;
        }

        try {
            new InteractiveSession(in, out, printer, cfg.maxDepth()).run();
        } catch (IOException ex) {
            err.println("ERROR: There was an error reading stdin: " + safeMsg(ex.getMessage()));
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private static void printUsage(PrintStream out) {
        out.println("dcgraph parses TCL code and extracts the procedure call dependencies.");
        out.println();
        out.println("Usage:");
        out.println("  dcgraph -b (TCL_FILE | DIRECTORY)+        Build the index (directories are searched recursively)");
        out.println("  dcgraph [-d] -f PROCEDURE [-d] [PROCEDURE [-d]]...");
        out.println("                                            Print the call sequence of each procedure,");
        out.println("                                            or its dependencies (direct callers) with -d");
        out.println("  dcgraph --delete-index                    Delete the index file, if any");
        out.println("  dcgraph                                   Interactive mode: one procedure name per line,");
        out.println("                                            add -d after the name for its dependencies");
        out.println("Options:");
        out.println("  --max-depth <N>, --max-depth=<N>          Call sequence depth, positive (default: "
                + Config.DEFAULT_MAX_DEPTH + ")");
        out.println("  --format=<text|json>                      Output format (default: text)");
        out.println("  --index=<path>                            Index file (default: $" + Config.INDEX_ENV
                + " or " + Config.DEFAULT_INDEX + ")");
        out.println("  --help, -h                                Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
