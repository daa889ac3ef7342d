package tcl.callgraph.graph;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import tcl.callgraph.scan.BuildAbortedException;
import tcl.callgraph.scan.ProcedureScanner;
import tcl.callgraph.scan.SourceFileFinder;
import tcl.callgraph.scan.TclSyntaxException;

/**
 * Runs the build pipeline: find TCL files, scan each, aggregate.
 * A file that cannot be read or does not lex is reported and skipped; the build goes on.
 */
public final class GraphBuilder {

    private final SourceFileFinder finder;
    private final ProcedureScanner scanner;
    private final PrintStream err;

    public GraphBuilder(SourceFileFinder finder, ProcedureScanner scanner, PrintStream err) {
        this.finder = Objects.requireNonNull(finder, "finder");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.err = Objects.requireNonNull(err, "err");
    }

    public BuildResult build(List<Path> inputs) throws IOException, BuildAbortedException {
        final List<Path> files = finder.findSourceFiles(inputs);

        final ParseStats stats = new ParseStats();
        final GraphAggregator aggregator = new GraphAggregator(stats);

        for (Path file : files) {
            try {
                aggregator.add(scanner.scanFile(file));
            } catch (TclSyntaxException ex) {
                stats.fileSkipped();
                err.println("WARN: skipping " + file + " -> " + ex.getMessage());
            } catch (IOException ex) {
                stats.fileSkipped();
                err.println("WARN: failed to read " + file + " -> "
                        + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            }
        }

        return new BuildResult(aggregator.result(), stats);
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
