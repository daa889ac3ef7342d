package tcl.callgraph.query;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Machine-readable output: one pretty-printed JSON document per answered query.
 * <p>
 * Call trees are streamed node by node, since their nesting follows --max-depth.
 */
public final class JsonRenderer implements ResultRenderer {

    private final PrintStream out;
    private final ObjectMapper jsonMapper;

    public JsonRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        final JsonFactory factory = JsonFactory.builder()
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
                .build();
        this.jsonMapper = new ObjectMapper(factory).enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void callSequence(CallTreeNode root) throws IOException {
        Objects.requireNonNull(root, "root");
        final StringWriter buf = new StringWriter();
        try (JsonGenerator gen = jsonMapper.getFactory().createGenerator(buf)) {
            gen.useDefaultPrettyPrinter();
            final Deque<Frame> stack = new ArrayDeque<>();
            open(gen, root, stack);
            while (!stack.isEmpty()) {
                final Frame frame = stack.peek();
                if (frame.next < frame.node.calls().size()) {
                    open(gen, frame.node.calls().get(frame.next++), stack);
                } else {
                    stack.pop();
                    gen.writeEndArray();
                    gen.writeEndObject();
                }
            }
        }
        out.println(buf);
        out.flush();
    }

    private static void open(JsonGenerator gen, CallTreeNode node, Deque<Frame> stack) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", node.name());
        gen.writeStringField("expansion", node.expansion().name());
        gen.writeArrayFieldStart("calls");
        stack.push(new Frame(node));
    }

    @Override
    public void dependencies(Dependencies dependencies) throws IOException {
        out.println(jsonMapper.writeValueAsString(dependencies));
        out.flush();
    }

    private static final class Frame {
        final CallTreeNode node;
        int next;

        Frame(CallTreeNode node) {
            this.node = node;
        }
    }
}
