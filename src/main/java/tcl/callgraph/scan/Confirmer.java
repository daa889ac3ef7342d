package tcl.callgraph.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Asks the operator a yes/no question. Anything but an explicit yes means no.
 */
@FunctionalInterface
public interface Confirmer {

    boolean confirm(String question) throws IOException;

    static Confirmer console(BufferedReader in, PrintStream prompt) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(prompt, "prompt");
        return question -> {
            prompt.print(question + " [y/N] ");
            prompt.flush();
            final String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            final String a = answer.trim().toLowerCase(Locale.ROOT);
            return "y".equals(a) || "yes".equals(a);
        };
    }
}
