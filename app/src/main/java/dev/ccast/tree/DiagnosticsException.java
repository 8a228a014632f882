package dev.ccast.tree;

import dev.ccast.engine.Diagnostic;
import java.nio.file.Path;
import java.util.List;

/**
 * Aggregate of every diagnostic the engine reported for one file. It travels alongside a (possibly partial) tree as
 * data; the library never throws it, callers may.
 */
public class DiagnosticsException extends Exception {
    private final Path path;
    private final List<Diagnostic> diagnostics;

    public DiagnosticsException(Path path, List<Diagnostic> diagnostics) {
        super(format(diagnostics));
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A diagnostics aggregate needs at least one diagnostic");
        }
        this.path = path;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Path getPath() {
        return path;
    }

    /** In the order the engine reported them. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::spelling).toList();
    }

    public int size() {
        return diagnostics.size();
    }

    private static String format(List<Diagnostic> diagnostics) {
        var sb = new StringBuilder();
        sb.append(diagnostics.size()).append(diagnostics.size() == 1 ? " error occurred:\n" : " errors occurred:\n");
        for (var diagnostic : diagnostics) {
            sb.append("\t* ").append(diagnostic.spelling()).append('\n');
        }
        return sb.append('\n').toString();
    }
}
