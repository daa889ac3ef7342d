package tcl.callgraph.graph;

/**
 * Counters for the post-build report. Nothing in the pipeline branches on them.
 */
public final class ParseStats {

    private int filesParsed;
    private int filesSkipped;
    private int procedures;
    private int callEdges;

    void fileParsed(int declaredProcedures, int edges) {
        filesParsed++;
        procedures += declaredProcedures;
        callEdges += edges;
    }

    void fileSkipped() {
        filesSkipped++;
    }

    public int filesParsed() {
        return filesParsed;
    }

    public int filesSkipped() {
        return filesSkipped;
    }

    /**
     * Procedure declarations seen, redefinitions included.
     */
    public int procedures() {
        return procedures;
    }

    public int callEdges() {
        return callEdges;
    }
}
