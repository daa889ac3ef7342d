package tcl.callgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Growable graph owned by the build pipeline.
 */
public final class MutableCallGraph implements CallGraph {

    private final Map<String, List<String>> edges = new LinkedHashMap<>();

    public void add(String from, String to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
    }

    @Override
    public boolean contains(String name) {
        return edges.containsKey(name);
    }

    @Override
    public List<String> get(String name) {
        final List<String> out = edges.get(name);
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    @Override
    public List<String> names() {
        return List.copyOf(edges.keySet());
    }
}
