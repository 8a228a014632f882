package dev.ccast.tree;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A tree whose parse session is still open. Use it in a try-with-resources block: node handles and {@link
 * #definitionOf(Node)} work inside the block and fail with {@link SessionClosedException} after it.
 */
public final class ParsedFile implements AutoCloseable {
    private final ParseSession session;
    private final Node root;
    private final Optional<DiagnosticsException> error;
    private final IdentityResolver resolver;

    public ParsedFile(
            ParseSession session, Node root, Optional<DiagnosticsException> error, IdentityResolver resolver) {
        this.session = Objects.requireNonNull(session, "session");
        this.root = Objects.requireNonNull(root, "root");
        this.error = Objects.requireNonNull(error, "error");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public Path path() {
        return session.path();
    }

    public Node root() {
        return root;
    }

    public Optional<DiagnosticsException> error() {
        return error;
    }

    public ParseSession session() {
        return session;
    }

    /**
     * The node of the construct defining the symbol {@code node} names, when the engine knows one and it is part of
     * this tree.
     */
    public Optional<Node> definitionOf(Node node) {
        session.checkOpen();
        return node.handle().definition().flatMap(resolver::lookup);
    }

    /** Drops the session and keeps the tree. */
    public ParseResult toResult() {
        close();
        return new ParseResult(root, error);
    }

    @Override
    public void close() {
        session.close();
    }
}
