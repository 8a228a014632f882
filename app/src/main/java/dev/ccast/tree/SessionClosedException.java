package dev.ccast.tree;

import java.nio.file.Path;

/**
 * A cursor handle was read after its parse session was closed. Cached node fields (kind, spelling, location) stay
 * readable forever; anything that reaches back into the engine does not.
 */
public class SessionClosedException extends IllegalStateException {
    public SessionClosedException(Path path) {
        super("Parse session for " + path + " is closed; cursor handles obtained from it are no longer valid");
    }
}
