package tcl.callgraph.query;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Human-readable output.
 * <pre>
 * -> a
 *   -> b
 *     -> c
 *       -> ...
 *       <- ...
 *     <- c
 *   <- b
 * <- a
 * </pre>
 * Dependencies come out as a numbered list framed by blank lines, numbers right-aligned.
 */
public final class TextRenderer implements ResultRenderer {

    private static final int INDENT_STEP = 2;
    private static final String PLACEHOLDER = "...";

    private final PrintStream out;

    public TextRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void callSequence(CallTreeNode root) {
        Objects.requireNonNull(root, "root");
        print(root);
        out.flush();
    }

    private void print(CallTreeNode root) {
        final Deque<Frame> stack = new ArrayDeque<>();
        open(root, 0, stack);
        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            if (frame.next < frame.node.calls().size()) {
                open(frame.node.calls().get(frame.next++), frame.indent + INDENT_STEP, stack);
            } else {
                stack.pop();
                leave(frame.node.name(), frame.indent);
            }
        }
    }

    private void open(CallTreeNode node, int indent, Deque<Frame> stack) {
        enter(node.name(), indent);
        if (node.expansion() == CallTreeNode.Expansion.UNKNOWN) {
            enter(PLACEHOLDER, indent + INDENT_STEP);
            leave(PLACEHOLDER, indent + INDENT_STEP);
        }
        stack.push(new Frame(node, indent));
    }

    private static final class Frame {
        final CallTreeNode node;
        final int indent;
        int next;

        Frame(CallTreeNode node, int indent) {
            this.node = node;
            this.indent = indent;
        }
    }

    private void enter(String name, int indent) {
        out.println(" ".repeat(indent) + "-> " + name);
    }

    private void leave(String name, int indent) {
        out.println(" ".repeat(indent) + "<- " + name);
    }

    @Override
    public void dependencies(Dependencies dependencies) {
        Objects.requireNonNull(dependencies, "dependencies");
        final List<String> callers = dependencies.callers();
        final int width = digits(callers.size());
        out.println();
        int number = 1;
        for (String caller : callers) {
            out.println(" ".repeat(width - digits(number)) + number + ". " + caller);
            number++;
        }
        out.println();
        out.flush();
    }

    private static int digits(int n) {
        return Integer.toString(Math.max(n, 0)).length();
    }
}
