package tcl.callgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import tcl.callgraph.model.CallEdge;
import tcl.callgraph.model.ScanResult;

public class GraphAggregatorTest {

    private static ScanResult file(String name, Set<String> declared, CallEdge... edges) {
        return new ScanResult(name, List.of(edges), declared);
    }

    @Test
    void reverseGraphIsTransposeWithMultiplicities() {
        final ParseStats stats = new ParseStats();
        final GraphAggregator aggregator = new GraphAggregator(stats);
        aggregator.add(file("one.tcl", Set.of("a"),
                new CallEdge("a", "b"), new CallEdge("a", "c"), new CallEdge("a", "b")));
        aggregator.add(file("two.tcl", Set.of("b"),
                new CallEdge("b", "c"), new CallEdge("b", "b")));

        final CallIndex index = aggregator.result();

        for (String caller : index.calls().names()) {
            for (String callee : index.calls().get(caller)) {
                assertEquals(
                        Collections.frequency(index.calls().get(caller), callee),
                        Collections.frequency(index.callers().get(callee), caller),
                        caller + " -> " + callee);
            }
        }
        assertEquals(index.calls().edgeCount(), index.callers().edgeCount());
        assertEquals(List.of("a", "a", "b"), index.callers().get("b"));
        assertEquals(List.of("a", "b"), index.callers().get("c"));
    }

    @Test
    void redefinitionAppendsEdgesInFileOrder() {
        final GraphAggregator aggregator = new GraphAggregator(new ParseStats());
        aggregator.add(file("first.tcl", Set.of("init"), new CallEdge("init", "x")));
        aggregator.add(file("second.tcl", Set.of("init"), new CallEdge("init", "y")));

        assertEquals(List.of("x", "y"), aggregator.result().calls().get("init"));
    }

    @Test
    void procedureWithoutCallsIsNotAKey() {
        final GraphAggregator aggregator = new GraphAggregator(new ParseStats());
        aggregator.add(file("f.tcl", Set.of("idle", "busy"), new CallEdge("busy", "work")));

        final CallIndex index = aggregator.result();
        assertFalse(index.calls().contains("idle"));
        assertEquals(List.of(), index.calls().get("idle"));
        assertTrue(index.isDeclared("idle"));
        assertFalse(index.callers().contains("busy"));
    }

    @Test
    void countsFilesProceduresAndEdges() {
        final ParseStats stats = new ParseStats();
        final GraphAggregator aggregator = new GraphAggregator(stats);
        aggregator.add(file("a.tcl", Set.of("p", "q"), new CallEdge("p", "q")));
        aggregator.add(file("b.tcl", Set.of("p"), new CallEdge("p", "r"), new CallEdge("p", "s")));

        assertEquals(2, stats.filesParsed());
        assertEquals(0, stats.filesSkipped());
        assertEquals(3, stats.procedures());
        assertEquals(3, stats.callEdges());
    }
}
