package tcl.callgraph.query;

import java.util.List;

/**
 * One procedure in a call sequence and the calls expanded beneath it.
 */
public record CallTreeNode(String name, Expansion expansion, List<CallTreeNode> calls) {

    public enum Expansion {
        /** callees listed in {@code calls} (possibly none besides a skipped self-call) */
        EXPANDED,
        /** the index has no calls recorded for this name */
        UNKNOWN,
        /** depth limit reached */
        TRUNCATED
    }

    public CallTreeNode {
        calls = List.copyOf(calls);
    }

    static CallTreeNode unknown(String name) {
        return new CallTreeNode(name, Expansion.UNKNOWN, List.of());
    }

    static CallTreeNode truncated(String name) {
        return new CallTreeNode(name, Expansion.TRUNCATED, List.of());
    }
}
