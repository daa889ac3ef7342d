package tcl.callgraph.query;

import java.io.IOException;

public interface ResultRenderer {

    void callSequence(CallTreeNode root) throws IOException;

    void dependencies(Dependencies dependencies) throws IOException;
}
