package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;

/**
 * How a cursor is turned into a {@link Fingerprint}. The engine hands the visitor fresh cursor objects on every
 * callback, so neither object identity nor {@code equals} can be used to find the node of a parent cursor.
 *
 * <p>Known limitation, both strategies: two distinct cursors can map to the same fingerprint. For {@link #STRUCTURAL}
 * that requires identical kind and identical extent (nested wrappers produced by macro expansion or error recovery);
 * for {@link #ENGINE_HASH} it is whatever the engine's hash function collides on. {@link IdentityResolver} counts and
 * logs these.
 */
public enum FingerprintStrategy {
    /** Kind plus start and end of the extent. Stable across engine versions. */
    STRUCTURAL {
        @Override
        String compute(EngineCursor cursor) {
            return cursor.kind() + "_" + cursor.extent();
        }
    },
    /** The engine's own cursor hash. Cheaper, but its meaning may change between engine versions. */
    ENGINE_HASH {
        @Override
        String compute(EngineCursor cursor) {
            return "#" + Integer.toHexString(cursor.hash());
        }
    };

    private static final String NULL_CURSOR = "<null>";

    abstract String compute(EngineCursor cursor);

    public Fingerprint fingerprint(EngineCursor cursor) {
        return new Fingerprint(this, cursor.isNull() ? NULL_CURSOR : compute(cursor));
    }
}
