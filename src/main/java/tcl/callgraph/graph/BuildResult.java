package tcl.callgraph.graph;

public record BuildResult(CallIndex index, ParseStats stats) {
}
