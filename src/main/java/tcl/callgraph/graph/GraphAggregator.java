package tcl.callgraph.graph;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import tcl.callgraph.model.CallEdge;
import tcl.callgraph.model.ScanResult;

/**
 * Merges per-file scan results into the project-wide call graph and its transpose.
 * <p>
 * A procedure declared in several files keeps the edges of every declaration, appended in
 * the order the files were added. TCL itself would keep only the last definition; the
 * union is kept on purpose so the ambiguity shows up in the call sequence.
 */
public final class GraphAggregator {

    private final MutableCallGraph calls = new MutableCallGraph();
    private final MutableCallGraph callers = new MutableCallGraph();
    private final Set<String> declared = new LinkedHashSet<>();
    private final ParseStats stats;

    public GraphAggregator(ParseStats stats) {
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public void add(ScanResult result) {
        Objects.requireNonNull(result, "result");
        for (CallEdge edge : result.edges()) {
            // both directions in lock-step
            calls.add(edge.caller(), edge.callee());
            callers.add(edge.callee(), edge.caller());
        }
        declared.addAll(result.declared());
        stats.fileParsed(result.declared().size(), result.edges().size());
    }

    public CallIndex result() {
        return new CallIndex(calls, callers, declared);
    }
}
