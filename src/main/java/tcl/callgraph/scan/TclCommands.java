package tcl.callgraph.scan;

import java.util.List;
import java.util.Set;

/**
 * Fixed knowledge about built-in TCL commands: which names are never recorded as calls,
 * and which arguments of the control commands hold scripts or expressions.
 */
public final class TclCommands {

    public enum ArgRole {
        PLAIN,      // ordinary word, only bracket substitutions are scanned
        SCRIPT,     // body evaluated as a script in the current scope
        EXPRESSION  // evaluated by expr, bracket substitutions are scanned even inside braces
    }

    private static final Set<String> RESERVED = Set.of(
            "after", "append", "apply", "array", "binary", "break", "case", "catch", "cd",
            "chan", "clock", "close", "concat", "continue", "coroutine", "dict", "else",
            "elseif", "encoding", "eof", "error", "eval", "exec", "exit", "expr", "fblocked",
            "fconfigure", "fcopy", "file", "fileevent", "flush", "for", "foreach", "format",
            "gets", "glob", "global", "if", "incr", "info", "interp", "join", "lappend",
            "lassign", "lindex", "linsert", "list", "llength", "lmap", "load", "lrange",
            "lrepeat", "lreplace", "lreverse", "lsearch", "lset", "lsort", "namespace",
            "open", "package", "pid", "proc", "puts", "pwd", "read", "regexp", "regsub",
            "rename", "return", "scan", "seek", "set", "socket", "source", "split", "string",
            "subst", "switch", "tailcall", "tell", "then", "throw", "time", "trace", "try",
            "unset", "update", "uplevel", "upvar", "variable", "vwait", "while", "yield"
    );

    private TclCommands() {
    }

    public static boolean isReserved(String command) {
        return RESERVED.contains(command);
    }

    /**
     * Role of argument {@code index} of a fixed-shape command. {@code if}, {@code switch}
     * and {@code try} have free-form argument lists and are walked by the scanner itself.
     */
    public static ArgRole argumentRole(String command, List<Token> args, int index) {
        final int last = args.size() - 1;
        return switch (command) {
            case "while" -> index == 0 ? ArgRole.EXPRESSION : index == 1 ? ArgRole.SCRIPT : ArgRole.PLAIN;
            case "for" -> index == 1 ? ArgRole.EXPRESSION : index <= 3 ? ArgRole.SCRIPT : ArgRole.PLAIN;
            case "foreach", "lmap" -> index == last && args.size() >= 3 ? ArgRole.SCRIPT : ArgRole.PLAIN;
            case "catch", "time" -> index == 0 ? ArgRole.SCRIPT : ArgRole.PLAIN;
            case "expr" -> ArgRole.EXPRESSION;
            case "namespace" -> index == last && args.size() >= 3 && args.get(0).isWord("eval")
                    ? ArgRole.SCRIPT
                    : ArgRole.PLAIN;
            case "dict" -> index == last && args.size() >= 3 && isDictScriptSubcommand(args.get(0))
                    ? ArgRole.SCRIPT
                    : ArgRole.PLAIN;
            default -> ArgRole.PLAIN;
        };
    }

    // dict for/map/update/with take a trailing body script
    private static boolean isDictScriptSubcommand(Token sub) {
        return sub.isWord("for") || sub.isWord("map") || sub.isWord("update") || sub.isWord("with");
    }
}
