package tcl.callgraph.model;

import java.util.Objects;

/**
 * One call site: {@code caller}'s body invokes {@code callee} in command position.
 */
public record CallEdge(String caller, String callee) {

    public CallEdge {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(callee, "callee");
    }

    public boolean isSelfCall() {
        return caller.equals(callee);
    }
}
