package tcl.callgraph.scan;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Expands build inputs into the list of TCL files to scan:
 * - a regular file is taken as is, unless its extension says it is not TCL
 * - a directory is searched recursively for *.tcl (hidden directories are skipped)
 * - anything else asks the operator whether to skip it or abort the build
 * Files under one directory come out sorted by path.
 */
public final class SourceFileFinder {

    public static final String TCL_EXTENSION = "tcl";

    private final Confirmer confirmer;
    private final PrintStream err;

    public SourceFileFinder(Confirmer confirmer, PrintStream err) {
        this.confirmer = Objects.requireNonNull(confirmer, "confirmer");
        this.err = Objects.requireNonNull(err, "err");
    }

    public List<Path> findSourceFiles(List<Path> inputs) throws IOException, BuildAbortedException {
        Objects.requireNonNull(inputs, "inputs");
        final List<Path> out = new ArrayList<>();

        for (Path input : inputs) {
            final String ext = extension(input);
            if (ext != null && !TCL_EXTENSION.equals(ext) && !Files.isDirectory(input)) {
                continue;
            }

            final BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(input, BasicFileAttributes.class);
            } catch (IOException ex) {
                err.println("WARN: cannot determine the type of " + input + " -> "
                        + ex.getClass().getSimpleName() + ": " + ex.getMessage());
                skipOrAbort(input);
                continue;
            }

            if (attrs.isDirectory()) {
                out.addAll(walk(input));
            } else if (attrs.isRegularFile()) {
                out.add(input);
            } else {
                err.println("WARN: " + input + " isn't a regular file or a directory");
                skipOrAbort(input);
            }
        }
        return out;
    }

    private void skipOrAbort(Path input) throws IOException, BuildAbortedException {
        if (!confirmer.confirm("Do you want to continue and skip this file?")) {
            throw new BuildAbortedException(input.toString());
        }
    }

    private List<Path> walk(Path root) throws IOException {
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                        if (!dir.equals(root) && name.startsWith(".")) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && TCL_EXTENSION.equals(extension(file))) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        err.println("WARN: skipping unreadable " + file + " -> "
                                + exc.getClass().getSimpleName() + ": " + exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        files.sort(null);
        return files;
    }

    static String extension(Path path) {
        final Path fileName = path.getFileName();
        if (fileName == null) {
            return null;
        }
        final String name = fileName.toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : null;
    }
}
