package tcl.callgraph.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the scanner extracted from one file.
 */
public record ScanResult(
        String file,            // path as discovered
        List<CallEdge> edges,   // source order, duplicates kept
        Set<String> declared    // declaration order
) {

    public ScanResult {
        Objects.requireNonNull(file, "file");
        edges = List.copyOf(edges);
        declared = Collections.unmodifiableSet(new LinkedHashSet<>(declared));
    }
}
