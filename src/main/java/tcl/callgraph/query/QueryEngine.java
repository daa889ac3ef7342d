package tcl.callgraph.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import tcl.callgraph.graph.CallGraph;
import tcl.callgraph.graph.CallIndex;

/**
 * Read-only queries over a loaded index.
 */
public final class QueryEngine {

    private final CallIndex index;

    public QueryEngine(CallIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Depth-first call tree rooted at {@code name}, at most {@code maxDepth} calls deep.
     * <p>
     * A direct self-call is never expanded. Indirect recursion (a -> b -> a) is only cut by
     * the depth limit. Empty when the index holds no calls for {@code name}.
     *
     * @throws IllegalArgumentException if {@code maxDepth} is not positive
     */
    public Optional<CallTreeNode> callSequence(String name, int maxDepth) {
        Objects.requireNonNull(name, "name");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("max depth must be a positive number, got " + maxDepth);
        }
        if (!index.calls().contains(name)) {
            return Optional.empty();
        }
        return Optional.of(expand(name, maxDepth));
    }

    // explicit stack: tree depth is bounded only by maxDepth
    private CallTreeNode expand(String root, int maxDepth) {
        final CallGraph calls = index.calls();
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, maxDepth, calls.get(root)));

        CallTreeNode result = null;
        while (result == null) {
            final Frame frame = stack.peek();
            if (frame.next < frame.callees.size()) {
                final String callee = frame.callees.get(frame.next++);
                if (callee.equals(frame.name)) {
                    continue;
                }
                if (!calls.contains(callee)) {
                    frame.children.add(CallTreeNode.unknown(callee));
                } else if (frame.remaining == 1) {
                    frame.children.add(CallTreeNode.truncated(callee));
                } else {
                    stack.push(new Frame(callee, frame.remaining - 1, calls.get(callee)));
                }
                continue;
            }
            stack.pop();
            final CallTreeNode node = new CallTreeNode(frame.name, CallTreeNode.Expansion.EXPANDED, frame.children);
            if (stack.isEmpty()) {
                result = node;
            } else {
                stack.peek().children.add(node);
            }
        }
        return result;
    }

    /** A node whose callees are still being expanded. */
    private static final class Frame {
        final String name;
        final int remaining;
        final List<String> callees;
        final List<CallTreeNode> children = new ArrayList<>();
        int next;

        Frame(String name, int remaining, List<String> callees) {
            this.name = name;
            this.remaining = remaining;
            this.callees = callees;
        }
    }

    public Dependencies dependencies(String name) {
        Objects.requireNonNull(name, "name");
        final CallGraph callers = index.callers();
        if (callers.contains(name)) {
            return new Dependencies(name, Dependencies.Status.KNOWN, callers.get(name));
        }
        final Dependencies.Status status = index.isDeclared(name)
                ? Dependencies.Status.DECLARED_NO_CALLERS
                : Dependencies.Status.UNKNOWN;
        return new Dependencies(name, status, List.of());
    }
}
