package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;
import java.util.Optional;

/**
 * Non-owning capability into the engine cursor a {@link Node} was built from. Valid exactly as long as the owning
 * {@link ParseSession} is open; every read after that throws {@link SessionClosedException}.
 */
public final class CursorHandle {
    private final ParseSession session;
    private final EngineCursor cursor;

    CursorHandle(ParseSession session, EngineCursor cursor) {
        this.session = session;
        this.cursor = cursor;
    }

    public boolean isValid() {
        return session.isOpen();
    }

    /** The live engine cursor. */
    public EngineCursor cursor() {
        session.checkOpen();
        return cursor;
    }

    public String prettyKind() {
        return cursor().prettyKind();
    }

    public String sourceText() {
        return cursor().sourceText();
    }

    /** The cursor defining the symbol this cursor names, if the engine knows one. */
    public Optional<EngineCursor> definition() {
        var definition = cursor().definition();
        return definition.isNull() ? Optional.empty() : Optional.of(definition);
    }
}
