package tcl.callgraph;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Command line, parsed.
 * <p>
 * Index location: --index=PATH, else $DCGRAPH_INDEX, else .dcgraph/index.cbor under the
 * working directory.
 */
public record Config(
        Mode mode,
        List<Path> buildInputs,
        List<ProcedureQuery> queries,
        int maxDepth,
        OutputFormat format,
        Path indexFile
) {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final String INDEX_ENV = "DCGRAPH_INDEX";
    public static final Path DEFAULT_INDEX = Paths.get(".dcgraph", "index.cbor");

    static final String BUILD_INDEX_OPT = "-b";
    static final String QUERY_FUNCTION_OPT = "-f";
    static final String PRINT_DEP_OPT = "-d";
    static final String MAX_DEPTH_OPT = "--max-depth";
    static final String DELETE_INDEX_OPT = "--delete-index";
    static final String HELP_OPT = "-h";
    static final String LONG_HELP_OPT = "--help";
    static final String FORMAT_OPT = "--format=";
    static final String INDEX_OPT = "--index=";

    public enum Mode {
        HELP,
        DELETE_INDEX,
        BUILD,
        QUERY,
        INTERACTIVE
    }

    public enum OutputFormat {
        TEXT,
        JSON
    }

    public record ProcedureQuery(String name, boolean dependencies) {
    }

    public Config {
        Objects.requireNonNull(mode, "mode");
        buildInputs = List.copyOf(buildInputs);
        queries = List.copyOf(queries);
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(indexFile, "indexFile");
    }

    public static Config parse(List<String> args, Map<String, String> env, Path workDir) throws UsageException {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(workDir, "workDir");

        Path indexArg = null;
        for (String arg : args) {
            if (arg.startsWith(INDEX_OPT)) {
                final String value = arg.substring(INDEX_OPT.length()).trim();
                if (value.isEmpty()) {
                    throw new UsageException("You must provide a path with " + INDEX_OPT);
                }
                indexArg = Paths.get(value);
            }
        }
        final Path indexFile = resolveIndexFile(indexArg, env, workDir);

        // --delete-index is independent of everything else on the line
        if (args.contains(DELETE_INDEX_OPT)) {
            return new Config(Mode.DELETE_INDEX, List.of(), List.of(), DEFAULT_MAX_DEPTH, OutputFormat.TEXT, indexFile);
        }

        final List<Path> buildInputs = new ArrayList<>();
        final List<String> names = new ArrayList<>();
        final List<Boolean> perNameDeps = new ArrayList<>();
        boolean build = false;
        boolean query = false;
        boolean allDeps = false;
        int maxDepth = DEFAULT_MAX_DEPTH;
        OutputFormat format = OutputFormat.TEXT;

        for (int i = 0; i < args.size(); i++) {
            final String arg = args.get(i);
            if (HELP_OPT.equals(arg) || LONG_HELP_OPT.equals(arg)) {
                return new Config(Mode.HELP, List.of(), List.of(), DEFAULT_MAX_DEPTH, OutputFormat.TEXT, indexFile);
            }
            if (BUILD_INDEX_OPT.equals(arg)) {
                build = true;
                while (i + 1 < args.size() && !isOption(args.get(i + 1))) {
                    buildInputs.add(Paths.get(args.get(++i)));
                }
                if (buildInputs.isEmpty()) {
                    throw new UsageException("You must provide at least one TCL file or directory after " + BUILD_INDEX_OPT);
                }
                continue;
            }
            if (QUERY_FUNCTION_OPT.equals(arg)) {
                query = true;
                final int before = names.size();
                while (i + 1 < args.size()) {
                    final String next = args.get(i + 1);
                    if (PRINT_DEP_OPT.equals(next) && names.size() > before) {
                        // -d right after a name applies to that name only
                        perNameDeps.set(perNameDeps.size() - 1, true);
                        i++;
                        continue;
                    }
                    if (isOption(next)) {
                        break;
                    }
                    names.add(next);
                    perNameDeps.add(false);
                    i++;
                }
                if (names.size() == before) {
                    throw new UsageException("You must provide at least one procedure name after " + QUERY_FUNCTION_OPT);
                }
                continue;
            }
            if (PRINT_DEP_OPT.equals(arg)) {
                allDeps = true;
                continue;
            }
            if (MAX_DEPTH_OPT.equals(arg)) {
                if (i + 1 >= args.size()) {
                    throw new UsageException("You must provide a positive number as the max depth");
                }
                maxDepth = parseMaxDepth(args.get(++i));
                continue;
            }
            if (arg.startsWith(MAX_DEPTH_OPT + "=")) {
                maxDepth = parseMaxDepth(arg.substring(MAX_DEPTH_OPT.length() + 1));
                continue;
            }
            if (arg.startsWith(FORMAT_OPT)) {
                format = parseFormat(arg.substring(FORMAT_OPT.length()));
                continue;
            }
            if (arg.startsWith(INDEX_OPT)) {
                continue;
            }
            if (arg.startsWith("-")) {
                throw new UsageException("Unknown option \"" + arg + "\"");
            }
            throw new UsageException("Unexpected argument \"" + arg + "\"");
        }

        final List<ProcedureQuery> queries = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            queries.add(new ProcedureQuery(names.get(i), allDeps || perNameDeps.get(i)));
        }

        final Mode mode = build ? Mode.BUILD : query ? Mode.QUERY : Mode.INTERACTIVE;
        return new Config(mode, buildInputs, queries, maxDepth, format, indexFile);
    }

    static Path resolveIndexFile(Path indexArg, Map<String, String> env, Path workDir) {
        Path p = indexArg;
        if (p == null) {
            final String fromEnv = env.get(INDEX_ENV);
            if (fromEnv != null && !fromEnv.isBlank()) {
                p = Paths.get(fromEnv.trim());
            }
        }
        if (p == null) {
            p = DEFAULT_INDEX;
        }
        return p.isAbsolute() ? p.normalize() : workDir.resolve(p).normalize();
    }

    private static boolean isOption(String v) {
        return BUILD_INDEX_OPT.equals(v)
                || QUERY_FUNCTION_OPT.equals(v)
                || PRINT_DEP_OPT.equals(v)
                || HELP_OPT.equals(v)
                || v.startsWith("--");
    }

    private static int parseMaxDepth(String raw) throws UsageException {
        final int depth;
        try {
            depth = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new UsageException("You must provide a positive number as the max depth, got \"" + raw + "\"");
        }
        if (depth <= 0) {
            throw new UsageException("You must provide a positive number as the max depth, got " + depth);
        }
        return depth;
    }

    private static OutputFormat parseFormat(String raw) throws UsageException {
        try {
            return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UsageException("Unknown output format \"" + raw + "\" (expected text or json)");
        }
    }

    public static final class UsageException extends Exception {

        public UsageException(String message) {
            super(message);
        }
    }
}
