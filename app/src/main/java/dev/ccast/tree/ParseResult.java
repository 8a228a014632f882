package dev.ccast.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * A tree whose parse session has already been closed, plus the diagnostics aggregate. Cached node fields are usable;
 * {@link Node#handle()} reads throw {@link SessionClosedException}.
 */
public record ParseResult(Node root, Optional<DiagnosticsException> error) {

    public ParseResult {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(error, "error");
    }

    public boolean hasDiagnostics() {
        return error.isPresent();
    }

    /** For callers that treat any diagnostic as fatal. */
    public Node rootOrThrow() throws DiagnosticsException {
        if (error.isPresent()) {
            throw error.get();
        }
        return root;
    }
}
