package tcl.callgraph.io;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

import tcl.callgraph.graph.CallIndex;
import tcl.callgraph.graph.GraphAggregator;
import tcl.callgraph.graph.ParseStats;
import tcl.callgraph.model.CallEdge;
import tcl.callgraph.model.ScanResult;

public class IndexStoreTest {

    @TempDir
    Path dir;

    private static CallIndex sampleIndex() {
        final GraphAggregator aggregator = new GraphAggregator(new ParseStats());
        aggregator.add(new ScanResult("lib.tcl", List.of(
                new CallEdge("a", "b"),
                new CallEdge("a", "c"),
                new CallEdge("a", "b"),
                new CallEdge("b", "c"),
                new CallEdge("fact", "fact")), Set.of("a", "b", "fact", "idle")));
        return aggregator.result();
    }

    @Test
    void writeThenReadPreservesBothGraphs() throws Exception {
        final IndexStore store = new IndexStore(dir.resolve("nested/index.cbor"));
        final CallIndex original = sampleIndex();

        store.write(original);
        final CallIndex loaded = store.read();

        for (String name : List.of("a", "b", "c", "fact", "idle", "missing")) {
            assertEquals(original.calls().get(name), loaded.calls().get(name), "calls of " + name);
            assertEquals(original.callers().get(name), loaded.callers().get(name), "callers of " + name);
            assertEquals(original.calls().contains(name), loaded.calls().contains(name), name);
        }
        assertEquals(List.of("b", "c", "b"), loaded.calls().get("a"));
        assertEquals(List.of("a", "a"), loaded.callers().get("b"));
        assertEquals(List.of("fact"), loaded.calls().get("fact"));
        assertEquals(original.declared(), loaded.declared());
        assertTrue(loaded.isDeclared("idle"));
        assertFalse(loaded.calls().contains("idle"));
    }

    @Test
    void sameIndexProducesSameBytes() throws Exception {
        final Path file = dir.resolve("index.cbor");
        final IndexStore store = new IndexStore(file);

        store.write(sampleIndex());
        final byte[] first = Files.readAllBytes(file);
        store.write(sampleIndex());

        assertArrayEquals(first, Files.readAllBytes(file));
    }

    @Test
    void writeReplacesPreviousIndexAndLeavesNoTempFiles() throws Exception {
        final Path file = dir.resolve("index.cbor");
        final IndexStore store = new IndexStore(file);
        store.write(sampleIndex());

        final GraphAggregator other = new GraphAggregator(new ParseStats());
        other.add(new ScanResult("x.tcl", List.of(new CallEdge("x", "y")), Set.of("x")));
        store.write(other.result());

        final CallIndex loaded = store.read();
        assertFalse(loaded.calls().contains("a"));
        assertEquals(List.of("y"), loaded.calls().get("x"));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void missingFileIsReportedAsNoIndex() {
        final IndexStore store = new IndexStore(dir.resolve("absent.cbor"));

        var ex = assertThrows(NoIndexException.class, store::read);
        assertEquals(dir.resolve("absent.cbor"), ex.file());
        assertTrue(ex.getMessage().contains("Build one first"), ex.getMessage());
    }

    @Test
    void garbageIsReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        Files.write(file, new byte[]{(byte) 0xA2, 0x61});

        var ex = assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
        assertTrue(ex.getMessage().contains("--delete-index"), ex.getMessage());
    }

    @Test
    void emptyFileIsReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        Files.write(file, new byte[0]);

        assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
    }

    @Test
    void nullDocumentIsReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        Files.write(file, new byte[]{(byte) 0xF6});

        var ex = assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
        assertTrue(ex.getMessage().contains("empty document"), ex.getMessage());
    }

    @Test
    void unknownSchemaIsReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        final IndexStore.IndexFileDto dto = IndexStore.toDto(sampleIndex());
        new ObjectMapper(new CBORFactory()).writeValue(file.toFile(), new IndexStore.IndexFileDto(
                "dcgraph-index/v0", dto.names(), dto.callOffsets(), dto.callTargets(),
                dto.callerOffsets(), dto.callerTargets(), dto.declared()));

        var ex = assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
        assertTrue(ex.getMessage().contains("dcgraph-index/v0"), ex.getMessage());
    }

    @Test
    void inconsistentOffsetsAreReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        new ObjectMapper(new CBORFactory()).writeValue(file.toFile(), new IndexStore.IndexFileDto(
                IndexStore.SCHEMA_VERSION, List.of("a", "b"),
                new int[]{0, 5, 1}, new int[]{1},
                new int[]{0, 0, 1}, new int[]{0},
                new int[]{0}));

        assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
    }

    @Test
    void missingSectionIsReportedAsCorrupt() throws Exception {
        final Path file = dir.resolve("index.cbor");
        new ObjectMapper(new CBORFactory()).writeValue(file.toFile(), new IndexStore.IndexFileDto(
                IndexStore.SCHEMA_VERSION, List.of("a"), new int[]{0, 0}, new int[0],
                null, null, new int[0]));

        assertThrows(CorruptIndexException.class, () -> new IndexStore(file).read());
    }

    @Test
    void deleteReportsWhetherAFileWasRemoved() throws Exception {
        final Path file = dir.resolve("index.cbor");
        final IndexStore store = new IndexStore(file);

        assertFalse(store.delete());
        store.write(sampleIndex());
        assertTrue(store.delete());
        assertFalse(Files.exists(file));
    }
}
