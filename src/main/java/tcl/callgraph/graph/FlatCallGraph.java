package tcl.callgraph.graph;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only graph loaded from an index file.
 * <p>
 * Adjacency is kept in compressed sparse row form: the neighbours of name {@code i} are
 * {@code targets[offsets[i] .. offsets[i + 1])}, each a position in the shared
 * {@link NameTable}. An empty range means the name is not a key.
 */
public final class FlatCallGraph implements CallGraph {

    private final NameTable table;
    private final int[] offsets;
    private final int[] targets;

    public FlatCallGraph(NameTable table, int[] offsets, int[] targets) {
        this.table = Objects.requireNonNull(table, "table");
        this.offsets = Objects.requireNonNull(offsets, "offsets");
        this.targets = Objects.requireNonNull(targets, "targets");
        validate();
    }

    private void validate() {
        if (offsets.length != table.size() + 1) {
            throw new IllegalArgumentException("expected " + (table.size() + 1)
                    + " offsets, found " + offsets.length);
        }
        if (offsets[0] != 0 || offsets[offsets.length - 1] != targets.length) {
            throw new IllegalArgumentException("offsets do not span the target array");
        }
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] < offsets[i - 1]) {
                throw new IllegalArgumentException("offsets decrease at position " + i);
            }
        }
        for (int t : targets) {
            if (t < 0 || t >= table.size()) {
                throw new IllegalArgumentException("target out of range: " + t);
            }
        }
    }

    @Override
    public boolean contains(String name) {
        final int p = table.position(name);
        return p >= 0 && offsets[p + 1] > offsets[p];
    }

    @Override
    public List<String> get(String name) {
        final int p = table.position(name);
        if (p < 0) {
            return List.of();
        }
        final int from = offsets[p];
        final int size = offsets[p + 1] - from;
        return new AbstractList<>() {
            @Override
            public String get(int index) {
                Objects.checkIndex(index, size);
                return table.name(targets[from + index]);
            }

            @Override
            public int size() {
                return size;
            }
        };
    }

    @Override
    public List<String> names() {
        final List<String> out = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            if (offsets[i + 1] > offsets[i]) {
                out.add(table.name(i));
            }
        }
        return out;
    }

    @Override
    public int edgeCount() {
        return targets.length;
    }
}
