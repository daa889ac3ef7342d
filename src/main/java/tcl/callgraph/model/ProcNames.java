package tcl.callgraph.model;

import java.nio.file.Path;
import java.util.Objects;

public final class ProcNames {

    private ProcNames() {
    }

    public static String fileScope(Path file) {
        Objects.requireNonNull(file, "file");
        return fileScope(displayPath(file));
    }

    public static String fileScope(String file) {
        Objects.requireNonNull(file, "file");
        return "<file:" + file + ">";
    }

    public static boolean isFileScope(String name) {
        return name != null && name.startsWith("<file:") && name.endsWith(">");
    }

    public static String displayPath(Path file) {
        return file.normalize().toString().replace('\\', '/');
    }

    /**
     * True when a command word names a procedure literally. Words carrying a variable or
     * command substitution, an escape or grouping characters are computed at run time and
     * cannot be resolved statically.
     */
    public static boolean isLiteral(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            switch (word.charAt(i)) {
                case '$', '[', ']', '\\', '{', '}', '"' -> {
                    return false;
                }
                default -> {
                }
            }
        }
        return true;
    }
}
