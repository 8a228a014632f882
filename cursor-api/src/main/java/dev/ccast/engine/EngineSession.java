package dev.ccast.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * One parsed translation unit. Owns every engine resource that cursors obtained from it alias; after {@link #close()}
 * those cursors must not be read.
 */
public interface EngineSession extends AutoCloseable {

    Path path();

    /** The arguments the session was opened with, verbatim. */
    List<String> arguments();

    /** The cursor of the translation unit itself. */
    EngineCursor rootCursor();

    /** All diagnostics produced while parsing, in the order the engine reports them. Complete once the session is open. */
    List<Diagnostic> diagnostics();

    /** Releases the session. Must be idempotent. */
    @Override
    void close();
}
