package tcl.callgraph.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The forward call graph, its transpose and the set of declared procedures.
 * Built by {@link GraphAggregator}, persisted and reloaded by the index store.
 */
public record CallIndex(
        CallGraph calls,       // caller -> callees
        CallGraph callers,     // callee -> callers
        Set<String> declared
) {

    public CallIndex {
        Objects.requireNonNull(calls, "calls");
        Objects.requireNonNull(callers, "callers");
        declared = Collections.unmodifiableSet(new LinkedHashSet<>(declared));
    }

    public boolean isDeclared(String name) {
        return declared.contains(name);
    }
}
