package tcl.callgraph.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

import tcl.callgraph.graph.CallGraph;
import tcl.callgraph.graph.CallIndex;
import tcl.callgraph.graph.FlatCallGraph;
import tcl.callgraph.graph.NameTable;

/**
 * Persists a {@link CallIndex} as a single CBOR document.
 * <p>
 * Layout: one table of every name, numbered by first appearance, and for each graph an
 * offsets/targets pair of name positions (compressed sparse rows), plus the positions of
 * declared procedures. Loading rebuilds {@link FlatCallGraph}s directly on those arrays.
 * Nothing time- or machine-dependent is stored, so an unchanged corpus always produces
 * the same bytes.
 */
public final class IndexStore {

    public static final String SCHEMA_VERSION = "dcgraph-index/v1";

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory());

    private final Path file;

    public IndexStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    /**
     * Replaces the index file wholesale. The new content is written next to the target and
     * moved over it, so a failed write leaves the previous index untouched.
     */
    public Path write(CallIndex index) throws IOException {
        Objects.requireNonNull(index, "index");
        final IndexFileDto dto = toDto(index);

        final Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        final Path tmp = Files.createTempFile(dir, file.getFileName().toString() + ".", ".tmp");
        try {
            try (OutputStream os = Files.newOutputStream(tmp)) {
                CBOR_MAPPER.writeValue(os, dto);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        return file;
    }

    public CallIndex read() throws IOException {
        if (!Files.exists(file)) {
            throw new NoIndexException(file);
        }
        final IndexFileDto dto;
        try {
            dto = CBOR_MAPPER.readValue(file.toFile(), IndexFileDto.class);
        } catch (JsonProcessingException ex) {
            throw new CorruptIndexException(file, ex.getOriginalMessage(), ex);
        }
        if (dto == null) {
            throw new CorruptIndexException(file, "empty document", null);
        }
        return fromDto(dto);
    }

    /**
     * Removes the index file. Returns false when there was none.
     */
    public boolean delete() throws IOException {
        return Files.deleteIfExists(file);
    }

    /* ================= DTO ================= */

    public record IndexFileDto(
            String schema,
            List<String> names,
            int[] callOffsets,
            int[] callTargets,
            int[] callerOffsets,
            int[] callerTargets,
            int[] declared
    ) {
    }

    static IndexFileDto toDto(CallIndex index) {
        final Map<String, Integer> positions = new LinkedHashMap<>();
        number(index.calls(), positions);
        number(index.callers(), positions);
        for (String name : index.declared()) {
            positions.putIfAbsent(name, positions.size());
        }

        final List<String> names = List.copyOf(positions.keySet());
        final int[][] calls = encode(index.calls(), names, positions);
        final int[][] callers = encode(index.callers(), names, positions);

        final int[] declared = new int[index.declared().size()];
        int i = 0;
        for (String name : index.declared()) {
            declared[i++] = positions.get(name);
        }

        return new IndexFileDto(SCHEMA_VERSION, names, calls[0], calls[1], callers[0], callers[1], declared);
    }

    private static void number(CallGraph graph, Map<String, Integer> positions) {
        for (String name : graph.names()) {
            positions.putIfAbsent(name, positions.size());
            for (String target : graph.get(name)) {
                positions.putIfAbsent(target, positions.size());
            }
        }
    }

    private static int[][] encode(CallGraph graph, List<String> names, Map<String, Integer> positions) {
        final int[] offsets = new int[names.size() + 1];
        final int[] targets = new int[graph.edgeCount()];
        int next = 0;
        for (int i = 0; i < names.size(); i++) {
            offsets[i] = next;
            for (String target : graph.get(names.get(i))) {
                targets[next++] = positions.get(target);
            }
        }
        offsets[names.size()] = next;
        return new int[][]{offsets, targets};
    }

    private CallIndex fromDto(IndexFileDto dto) throws CorruptIndexException {
        if (!SCHEMA_VERSION.equals(dto.schema())) {
            throw new CorruptIndexException(file, "unexpected schema: " + dto.schema(), null);
        }
        if (dto.names() == null || dto.callOffsets() == null || dto.callTargets() == null
                || dto.callerOffsets() == null || dto.callerTargets() == null || dto.declared() == null) {
            throw new CorruptIndexException(file, "missing section", null);
        }
        try {
            final NameTable table = new NameTable(dto.names());
            final FlatCallGraph calls = new FlatCallGraph(table, dto.callOffsets(), dto.callTargets());
            final FlatCallGraph callers = new FlatCallGraph(table, dto.callerOffsets(), dto.callerTargets());
            if (calls.edgeCount() != callers.edgeCount()) {
                throw new IllegalArgumentException("call and caller edge counts differ");
            }
            final Set<String> declared = new LinkedHashSet<>();
            for (int p : dto.declared()) {
                if (p < 0 || p >= table.size()) {
                    throw new IllegalArgumentException("declared position out of range: " + p);
                }
                declared.add(table.name(p));
            }
            return new CallIndex(calls, callers, declared);
        } catch (IllegalArgumentException ex) {
            throw new CorruptIndexException(file, ex.getMessage(), ex);
        }
    }
}
