package tcl.callgraph.graph;

import java.util.List;

/**
 * Read view of a directed name graph: name -> ordered adjacent names.
 * <p>
 * A name with no edges is simply absent; {@link #get(String)} then returns an empty list,
 * so "no key" and "empty list" look the same to callers.
 */
public interface CallGraph {

    boolean contains(String name);

    /**
     * Adjacent names in insertion order, duplicates kept. Empty when absent.
     */
    List<String> get(String name);

    /**
     * Keys in insertion order.
     */
    List<String> names();

    default int edgeCount() {
        int n = 0;
        for (String name : names()) {
            n += get(name).size();
        }
        return n;
    }
}
