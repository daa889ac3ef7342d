package tcl.callgraph.scan;

/**
 * One lexical unit of TCL source.
 * <p>
 * For {@link Kind#BRACE_GROUP}, {@link Kind#BRACKET_GROUP} and {@link Kind#QUOTED} the text is
 * what lies between the delimiters. For {@link Kind#COMMENT} it is everything after the '#'.
 */
public record Token(
        Kind kind,
        String text,
        int line      // 1-based line the token starts on
) {

    public enum Kind {
        WORD,
        BRACE_GROUP,
        BRACKET_GROUP,
        QUOTED,
        COMMENT,
        COMMAND_END
    }

    public boolean isWord(String expected) {
        return kind == Kind.WORD && text.equals(expected);
    }
}
