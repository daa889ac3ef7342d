package tcl.callgraph.scan;

/**
 * The operator declined to skip a build input that could not be used.
 */
public final class BuildAbortedException extends Exception {

    public BuildAbortedException(String input) {
        super("build aborted at input: " + input);
    }
}
