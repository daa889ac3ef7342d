package tcl.callgraph.query;

import java.util.List;

/**
 * Direct callers of a procedure, first discovered first.
 */
public record Dependencies(String name, Status status, List<String> callers) {

    public enum Status {
        KNOWN,
        /** declared by a proc in the corpus, but nothing calls it */
        DECLARED_NO_CALLERS,
        /** neither declared nor called anywhere in the index */
        UNKNOWN
    }

    public Dependencies {
        callers = List.copyOf(callers);
    }
}
