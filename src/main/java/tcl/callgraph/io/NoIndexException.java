package tcl.callgraph.io;

import java.nio.file.Path;

/**
 * No index has been built at the configured location yet.
 */
public final class NoIndexException extends IndexStoreException {

    public NoIndexException(Path file) {
        super(file, "There is no index file at " + file
                + ". Build one first with \"dcgraph -b (TCL_FILE | DIRECTORY)+\".", null);
    }
}
