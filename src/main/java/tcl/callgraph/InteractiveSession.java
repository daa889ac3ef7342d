package tcl.callgraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

import tcl.callgraph.query.QueryPrinter;

/**
 * Line-oriented query loop: one procedure name per line, "-d" after it for dependencies.
 * Ends at end of input; a read error propagates.
 */
public final class InteractiveSession {

    static final String PROMPT = "Enter a procedure name (add -d at the end to print the dependencies): ";

    private final BufferedReader in;
    private final PrintStream out;
    private final QueryPrinter printer;
    private final int maxDepth;

    public InteractiveSession(BufferedReader in, PrintStream out, QueryPrinter printer, int maxDepth) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.printer = Objects.requireNonNull(printer, "printer");
        this.maxDepth = maxDepth;
    }

    /**
     * @return number of queries answered
     */
    public int run() throws IOException {
        int answered = 0;
        for (;;) {
            out.print("\n" + PROMPT);
            out.flush();
            final String line = in.readLine();
            if (line == null) {
                out.println();
                return answered;
            }
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            final String[] parts = trimmed.split("\\s+");
            final String name = parts[0];
            final boolean dependencies = parts.length > 1 && Config.PRINT_DEP_OPT.equals(parts[parts.length - 1]);

            if (dependencies) {
                printer.printDependencies(name);
            } else {
                out.println();
                printer.printCallSequence(name, maxDepth);
            }
            answered++;
        }
    }
}
