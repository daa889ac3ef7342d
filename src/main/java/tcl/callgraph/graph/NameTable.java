package tcl.callgraph.graph;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every procedure name of a loaded index, stored once and addressed by position.
 */
public final class NameTable {

    private final String[] names;
    private final Map<String, Integer> positions;

    public NameTable(List<String> names) {
        Objects.requireNonNull(names, "names");
        this.names = names.toArray(new String[0]);
        this.positions = new HashMap<>(this.names.length * 2);
        for (int i = 0; i < this.names.length; i++) {
            final String name = this.names[i];
            if (name == null) {
                throw new IllegalArgumentException("null name at position " + i);
            }
            if (positions.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("duplicate name: " + name);
            }
        }
    }

    public int size() {
        return names.length;
    }

    public String name(int position) {
        return names[position];
    }

    /**
     * Position of the name, or -1 when unknown.
     */
    public int position(String name) {
        final Integer p = positions.get(name);
        return p == null ? -1 : p;
    }

    public List<String> asList() {
        return Collections.unmodifiableList(Arrays.asList(names));
    }
}
