package tcl.callgraph.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import tcl.callgraph.scan.Token.Kind;

/**
 * Lazy, single-pass tokenizer for TCL scripts.
 * <p>
 * Only the grouping rules of the language are honoured:
 * - {...} nests and suppresses everything but backslash escapes
 * - [...] nests and holds a full script (words, quotes, braces, brackets)
 * - "..." ends at the first unescaped quote outside a bracket substitution
 * - '#' starts a comment only where a command may start
 * - backslash-newline separates words but never ends a command
 * Nothing is substituted or evaluated.
 */
public final class TclLexer {

    private final String src;
    private final int len;
    private int pos;
    private int line;
    private boolean commandStart = true;

    public TclLexer(String source) {
        this(source, 1);
    }

    public TclLexer(String source, int firstLine) {
        this.src = Objects.requireNonNull(source, "source");
        this.len = source.length();
        this.line = firstLine;
    }

    /**
     * Bracket substitutions found in the text of a word, quoted string or expression,
     * in order of appearance. Each returned token is a {@link Kind#BRACKET_GROUP} holding
     * the script between the brackets.
     */
    public static List<Token> substitutions(String text, int firstLine) throws TclSyntaxException {
        return new TclLexer(text, firstLine).collectSubstitutions();
    }

    /**
     * Returns the next token, or null once the input is exhausted.
     */
    public Token next() throws TclSyntaxException {
        skipBlanks();
        if (pos >= len) {
            return null;
        }

        final int start = pos;
        final int startLine = line;
        final char c = src.charAt(pos);

        if (c == '\n' || c == ';') {
            advanceTo(pos + 1);
            commandStart = true;
            return new Token(Kind.COMMAND_END, String.valueOf(c), startLine);
        }
        if (c == '#' && commandStart) {
            final int end = skipComment(pos);
            advanceTo(end);
            return new Token(Kind.COMMENT, stripCarriageReturn(src.substring(start + 1, end)), startLine);
        }

        commandStart = false;

        if (c == '{') {
            final int end = skipBraces(pos);
            advanceTo(end);
            return new Token(Kind.BRACE_GROUP, src.substring(start + 1, end - 1), startLine);
        }
        if (c == '"') {
            final int end = skipQuoted(pos);
            advanceTo(end);
            return new Token(Kind.QUOTED, src.substring(start + 1, end - 1), startLine);
        }

        int end;
        if (c == '[') {
            final int close = skipBracket(pos);
            if (isWordEndAt(close)) {
                advanceTo(close);
                return new Token(Kind.BRACKET_GROUP, src.substring(start + 1, close - 1), startLine);
            }
            end = skipBareWord(close, false);
        } else {
            end = skipBareWord(pos, false);
        }
        advanceTo(end);
        return new Token(Kind.WORD, src.substring(start, end), startLine);
    }

    private List<Token> collectSubstitutions() throws TclSyntaxException {
        final List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < len) {
            final char ch = src.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '$' && i + 1 < len && src.charAt(i + 1) == '{') {
                i = skipVariableName(i);
                continue;
            }
            if (ch == '[') {
                advanceTo(i);
                final int close = skipBracket(i);
                out.add(new Token(Kind.BRACKET_GROUP, src.substring(i + 1, close - 1), line));
                i = close;
                continue;
            }
            i++;
        }
        return out;
    }

    private void skipBlanks() {
        while (pos < len) {
            final char c = src.charAt(pos);
            if (isBlank(c)) {
                pos++;
                continue;
            }
            if (c == '\\') {
                final int after = continuationEnd(pos);
                if (after > 0) {
                    advanceTo(after);
                    continue;
                }
            }
            break;
        }
    }

    // returns the index of the newline ending the comment (not consumed)
    private int skipComment(int hash) {
        int i = hash + 1;
        while (i < len) {
            final char ch = src.charAt(i);
            if (ch == '\\') {
                final int after = continuationEnd(i);
                i = after > 0 ? after : i + 2;
                continue;
            }
            if (ch == '\n') {
                break;
            }
            i++;
        }
        return Math.min(i, len);
    }

    private int skipBraces(int open) throws TclSyntaxException {
        int depth = 0;
        int i = open;
        while (i < len) {
            final char ch = src.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        throw new TclSyntaxException("brace", lineAt(open));
    }

    private int skipQuoted(int open) throws TclSyntaxException {
        int i = open + 1;
        while (i < len) {
            final char ch = src.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '"') {
                return i + 1;
            }
            if (ch == '[') {
                i = skipBracket(i);
                continue;
            }
            if (ch == '$' && i + 1 < len && src.charAt(i + 1) == '{') {
                i = skipVariableName(i);
                continue;
            }
            i++;
        }
        throw new TclSyntaxException("quote", lineAt(open));
    }

    private int skipBracket(int open) throws TclSyntaxException {
        return skipScript(open + 1, open) + 1;
    }

    // returns the index of the ']' closing the script opened at 'open'
    private int skipScript(int from, int open) throws TclSyntaxException {
        boolean atCommand = true;
        int i = from;
        while (i < len) {
            final char ch = src.charAt(i);
            if (isBlank(ch)) {
                i++;
                continue;
            }
            if (ch == '\\') {
                final int after = continuationEnd(i);
                if (after > 0) {
                    i = after;
                    continue;
                }
            }
            if (ch == '\n' || ch == ';') {
                atCommand = true;
                i++;
                continue;
            }
            if (ch == ']') {
                return i;
            }
            if (ch == '#' && atCommand) {
                i = skipComment(i);
                continue;
            }
            atCommand = false;
            if (ch == '{') {
                i = skipBraces(i);
            } else if (ch == '"') {
                i = skipQuoted(i);
            } else {
                i = skipBareWord(i, true);
            }
        }
        throw new TclSyntaxException("bracket", lineAt(open));
    }

    private int skipBareWord(int from, boolean nested) throws TclSyntaxException {
        int i = from;
        while (i < len) {
            final char ch = src.charAt(i);
            if (isBlank(ch) || ch == '\n' || ch == ';') {
                break;
            }
            if (ch == ']' && nested) {
                break;
            }
            if (ch == '\\') {
                if (continuationEnd(i) > 0) {
                    break;
                }
                i += 2;
                continue;
            }
            if (ch == '[') {
                i = skipBracket(i);
                continue;
            }
            if (ch == '$' && i + 1 < len && src.charAt(i + 1) == '{') {
                i = skipVariableName(i);
                continue;
            }
            i++;
        }
        return Math.min(i, len);
    }

    private int skipVariableName(int dollar) throws TclSyntaxException {
        final int close = src.indexOf('}', dollar + 2);
        if (close < 0) {
            throw new TclSyntaxException("variable name brace", lineAt(dollar));
        }
        return close + 1;
    }

    // index just past a backslash-newline starting at i, or -1
    private int continuationEnd(int i) {
        if (i + 1 < len && src.charAt(i + 1) == '\n') {
            return i + 2;
        }
        if (i + 2 < len && src.charAt(i + 1) == '\r' && src.charAt(i + 2) == '\n') {
            return i + 3;
        }
        return -1;
    }

    private boolean isWordEndAt(int i) {
        if (i >= len) {
            return true;
        }
        final char ch = src.charAt(i);
        return isBlank(ch) || ch == '\n' || ch == ';' || (ch == '\\' && continuationEnd(i) > 0);
    }

    private void advanceTo(int end) {
        final int stop = Math.min(end, len);
        for (int i = pos; i < stop; i++) {
            if (src.charAt(i) == '\n') {
                line++;
            }
        }
        pos = stop;
    }

    private int lineAt(int index) {
        int l = line;
        for (int i = pos; i < index && i < len; i++) {
            if (src.charAt(i) == '\n') {
                l++;
            }
        }
        return l;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private static String stripCarriageReturn(String s) {
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }
}
