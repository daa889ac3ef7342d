package tcl.callgraph.io;

import java.io.IOException;
import java.nio.file.Path;

public class IndexStoreException extends IOException {

    private final Path file;

    public IndexStoreException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
