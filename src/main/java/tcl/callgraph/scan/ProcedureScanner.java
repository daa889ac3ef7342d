package tcl.callgraph.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import tcl.callgraph.model.CallEdge;
import tcl.callgraph.model.ProcNames;
import tcl.callgraph.model.ScanResult;
import tcl.callgraph.scan.TclCommands.ArgRole;

/**
 * Extracts procedure declarations and call sites from one TCL file.
 * <p>
 * A call is recorded for every literal, non-reserved command word, attributed to the
 * innermost enclosing {@code proc} or to the file scope. Edges come out in lexical order:
 * a command's own edge first, then the edges found in its arguments, depth-first.
 */
public final class ProcedureScanner {

    public ScanResult scanFile(Path file) throws IOException, TclSyntaxException {
        Objects.requireNonNull(file, "file");
        // lenient decode: malformed bytes become U+FFFD instead of failing the file
        final String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return scan(ProcNames.displayPath(file), source);
    }

    public ScanResult scan(String file, String source) throws TclSyntaxException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(source, "source");

        final Collector out = new Collector();
        scanScript(source, 1, ProcNames.fileScope(file), out);
        return new ScanResult(file, out.edges, out.declared);
    }

    private void scanScript(String script, int firstLine, String scope, Collector out) throws TclSyntaxException {
        final TclLexer lexer = new TclLexer(script, firstLine);
        List<Token> words = new ArrayList<>();
        Token token;
        while ((token = lexer.next()) != null) {
            switch (token.kind()) {
                case COMMENT -> {
                }
                case COMMAND_END -> {
                    if (!words.isEmpty()) {
                        scanCommand(words, scope, out);
                        words = new ArrayList<>();
                    }
                }
                default -> words.add(token);
            }
        }
        if (!words.isEmpty()) {
            scanCommand(words, scope, out);
        }
    }

    private void scanCommand(List<Token> words, String scope, Collector out) throws TclSyntaxException {
        final Token head = words.get(0);
        final List<Token> args = words.subList(1, words.size());

        if (head.kind() != Token.Kind.WORD || !ProcNames.isLiteral(head.text())) {
            // computed command name: no edge, but its substitutions still run
            scanWord(head, scope, out);
            for (Token arg : args) {
                scanWord(arg, scope, out);
            }
            return;
        }

        final String command = head.text();
        if ("proc".equals(command)) {
            scanProc(args, scope, out);
            return;
        }
        if (!TclCommands.isReserved(command)) {
            out.edges.add(new CallEdge(scope, command));
        }

        switch (command) {
            case "if" -> scanIf(args, scope, out);
            case "switch" -> scanSwitch(args, scope, out);
            case "try" -> scanTry(args, scope, out);
            default -> {
                for (int i = 0; i < args.size(); i++) {
                    scanArgument(args.get(i), TclCommands.argumentRole(command, args, i), scope, out);
                }
            }
        }
    }

    private void scanProc(List<Token> args, String scope, Collector out) throws TclSyntaxException {
        if (args.size() < 3) {
            for (Token arg : args) {
                scanWord(arg, scope, out);
            }
            return;
        }
        final Token nameToken = args.get(0);
        final Token body = args.get(2);
        final boolean literalName = nameToken.kind() == Token.Kind.BRACE_GROUP
                || ((nameToken.kind() == Token.Kind.WORD || nameToken.kind() == Token.Kind.QUOTED)
                && ProcNames.isLiteral(nameToken.text()));
        if (!literalName || nameToken.text().isEmpty()) {
            // computed procedure names are out of reach
            return;
        }

        final String name = nameToken.text();
        out.declared.add(name);
        if (body.kind() == Token.Kind.BRACE_GROUP || body.kind() == Token.Kind.QUOTED) {
            scanScript(body.text(), body.line(), name, out);
        }
    }

    // if cond ?then? body ?elseif cond ?then? body ...? ?else? ?body?
    private void scanIf(List<Token> args, String scope, Collector out) throws TclSyntaxException {
        int i = 0;
        while (i < args.size()) {
            scanArgument(args.get(i++), ArgRole.EXPRESSION, scope, out);
            if (i < args.size() && args.get(i).isWord("then")) {
                i++;
            }
            if (i < args.size()) {
                scanArgument(args.get(i++), ArgRole.SCRIPT, scope, out);
            }
            if (i >= args.size()) {
                return;
            }
            if (args.get(i).isWord("elseif")) {
                i++;
                continue;
            }
            if (args.get(i).isWord("else")) {
                i++;
            }
            while (i < args.size()) {
                scanArgument(args.get(i++), ArgRole.SCRIPT, scope, out);
            }
        }
    }

    // switch ?options? string {pattern body ...}  |  switch ?options? string pattern body ...
    private void scanSwitch(List<Token> args, String scope, Collector out) throws TclSyntaxException {
        int i = 0;
        while (i < args.size()) {
            final Token t = args.get(i);
            if (t.kind() != Token.Kind.WORD || !t.text().startsWith("-")) {
                break;
            }
            i++;
            if ("--".equals(t.text())) {
                break;
            }
            if ("-matchvar".equals(t.text()) || "-indexvar".equals(t.text())) {
                i++;
            }
        }
        if (i < args.size()) {
            scanWord(args.get(i++), scope, out);
        }

        final List<Token> rest = args.subList(Math.min(i, args.size()), args.size());
        if (rest.size() == 1 && rest.get(0).kind() == Token.Kind.BRACE_GROUP) {
            final Token block = rest.get(0);
            final List<Token> items = new ArrayList<>();
            final TclLexer lexer = new TclLexer(block.text(), block.line());
            Token item;
            while ((item = lexer.next()) != null) {
                if (item.kind() != Token.Kind.COMMAND_END && item.kind() != Token.Kind.COMMENT) {
                    items.add(item);
                }
            }
            scanSwitchArms(items, false, scope, out);
        } else {
            scanSwitchArms(rest, true, scope, out);
        }
    }

    private void scanSwitchArms(List<Token> arms, boolean inline, String scope, Collector out)
            throws TclSyntaxException {
        for (int j = 0; j < arms.size(); j += 2) {
            if (inline) {
                scanWord(arms.get(j), scope, out);
            }
            if (j + 1 < arms.size() && !arms.get(j + 1).isWord("-")) {
                scanArgument(arms.get(j + 1), ArgRole.SCRIPT, scope, out);
            }
        }
    }

    // try body ?on code vars body? ?trap pattern vars body? ?finally body?
    private void scanTry(List<Token> args, String scope, Collector out) throws TclSyntaxException {
        if (args.isEmpty()) {
            return;
        }
        scanArgument(args.get(0), ArgRole.SCRIPT, scope, out);
        int i = 1;
        while (i < args.size()) {
            final Token t = args.get(i);
            if (t.isWord("finally") && i + 1 < args.size()) {
                scanArgument(args.get(i + 1), ArgRole.SCRIPT, scope, out);
                i += 2;
            } else if ((t.isWord("on") || t.isWord("trap")) && i + 3 < args.size()) {
                scanWord(args.get(i + 1), scope, out);
                scanArgument(args.get(i + 3), ArgRole.SCRIPT, scope, out);
                i += 4;
            } else {
                scanWord(t, scope, out);
                i++;
            }
        }
    }

    private void scanArgument(Token arg, ArgRole role, String scope, Collector out) throws TclSyntaxException {
        switch (role) {
            case SCRIPT -> {
                if (arg.kind() == Token.Kind.WORD) {
                    scanWord(arg, scope, out);
                } else {
                    scanScript(arg.text(), arg.line(), scope, out);
                }
            }
            case EXPRESSION -> {
                if (arg.kind() == Token.Kind.BRACKET_GROUP) {
                    scanScript(arg.text(), arg.line(), scope, out);
                } else {
                    scanSubstitutions(arg, scope, out);
                }
            }
            default -> scanWord(arg, scope, out);
        }
    }

    private void scanWord(Token word, String scope, Collector out) throws TclSyntaxException {
        switch (word.kind()) {
            case BRACKET_GROUP -> scanScript(word.text(), word.line(), scope, out);
            case WORD, QUOTED -> scanSubstitutions(word, scope, out);
            default -> {
                // brace groups are literal
            }
        }
    }

    private void scanSubstitutions(Token word, String scope, Collector out) throws TclSyntaxException {
        if (word.text().indexOf('[') < 0) {
            return;
        }
        for (Token sub : TclLexer.substitutions(word.text(), word.line())) {
            scanScript(sub.text(), sub.line(), scope, out);
        }
    }

    private static final class Collector {
        final List<CallEdge> edges = new ArrayList<>();
        final Set<String> declared = new LinkedHashSet<>();
    }
}
