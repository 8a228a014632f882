package dev.ccast.tree;

import dev.ccast.engine.Diagnostic;
import dev.ccast.engine.EngineCursor;
import dev.ccast.engine.EngineSession;
import dev.ccast.engine.ParseEngine;
import dev.ccast.engine.ParseFailureException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns the lifetime of one engine session. Cursor handles held by tree nodes check {@link #checkOpen()} before every
 * read, so reading through them after {@link #close()} fails with {@link SessionClosedException} instead of touching
 * released engine memory.
 *
 * <p>Not thread-safe: a session belongs to the caller that opened it, and at most one tree build may run against it at
 * a time. Closing it while a build is running is a programming error.
 */
public final class ParseSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ParseSession.class);

    private final EngineSession engineSession;
    private boolean closed;
    private boolean traversing;

    ParseSession(EngineSession engineSession) {
        this.engineSession = Objects.requireNonNull(engineSession, "engineSession");
    }

    public static ParseSession open(ParseEngine engine, Path path, List<String> arguments)
            throws ParseFailureException {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(path, "path");
        logger.debug("Opening parse session for {} with arguments {}", path, arguments);
        return new ParseSession(engine.open(path, List.copyOf(arguments)));
    }

    public Path path() {
        return engineSession.path();
    }

    public List<String> arguments() {
        return engineSession.arguments();
    }

    public EngineCursor rootCursor() {
        checkOpen();
        return engineSession.rootCursor();
    }

    public List<Diagnostic> diagnostics() {
        checkOpen();
        return engineSession.diagnostics();
    }

    public boolean isOpen() {
        return !closed;
    }

    /** @throws SessionClosedException if the session has been closed */
    public void checkOpen() {
        if (closed) {
            throw new SessionClosedException(path());
        }
    }

    void beginTraversal() {
        checkOpen();
        if (traversing) {
            throw new IllegalStateException("A tree build is already running against " + path());
        }
        traversing = true;
    }

    void endTraversal() {
        traversing = false;
    }

    /** Releases the engine session. Calling it again is a no-op. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (traversing) {
            throw new IllegalStateException(
                    "Cannot close the parse session for " + path() + " while a tree build is running");
        }
        closed = true;
        engineSession.close();
        logger.debug("Closed parse session for {}", path());
    }
}
