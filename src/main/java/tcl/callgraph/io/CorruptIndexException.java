package tcl.callgraph.io;

import java.nio.file.Path;

/**
 * An index file exists but cannot be decoded or is internally inconsistent.
 */
public final class CorruptIndexException extends IndexStoreException {

    public CorruptIndexException(Path file, String detail, Throwable cause) {
        super(file, "Index file " + file + " is unreadable (" + detail
                + "). Delete it with --delete-index and build it again.", cause);
    }
}
