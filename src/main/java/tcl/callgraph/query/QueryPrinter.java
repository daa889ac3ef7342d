package tcl.callgraph.query;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers one query: the result goes to the renderer, "nothing known" goes to the
 * diagnostic stream. An unknown name is an expected outcome, not a failure.
 */
public final class QueryPrinter {

    private final QueryEngine engine;
    private final ResultRenderer renderer;
    private final PrintStream err;

    public QueryPrinter(QueryEngine engine, ResultRenderer renderer, PrintStream err) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * @return false when the index holds no calls for {@code name}
     */
    public boolean printCallSequence(String name, int maxDepth) throws IOException {
        final Optional<CallTreeNode> tree = engine.callSequence(name, maxDepth);
        if (tree.isEmpty()) {
            err.println("There's no info available for procedure \"" + name + "\"");
            return false;
        }
        renderer.callSequence(tree.get());
        return true;
    }

    /**
     * @return false when no caller is recorded for {@code name}
     */
    public boolean printDependencies(String name) throws IOException {
        final Dependencies deps = engine.dependencies(name);
        switch (deps.status()) {
            case KNOWN -> {
                renderer.dependencies(deps);
                return true;
            }
            case DECLARED_NO_CALLERS -> {
                err.println("Procedure \"" + name + "\" is declared but no recorded procedure calls it");
                return false;
            }
            default -> {
                err.println("There's no dependency info available for procedure \"" + name + "\"");
                return false;
            }
        }
    }
}
