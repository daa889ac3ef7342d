package tcl.callgraph.scan;

/**
 * Structural error in a TCL file: a brace, quote or bracket that never closes.
 */
public final class TclSyntaxException extends Exception {

    private final int line;

    public TclSyntaxException(String construct, int line) {
        super("unterminated " + construct + " opened on line " + line);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
