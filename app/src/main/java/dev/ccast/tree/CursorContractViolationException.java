package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;

/**
 * The engine visited a cursor whose parent was never visited itself, or the fingerprint strategy failed to re-identify
 * the parent. Either way the visitor contract is broken and there is nothing a caller can recover.
 */
public class CursorContractViolationException extends IllegalStateException {
    public CursorContractViolationException(EngineCursor parent) {
        super("Unable to locate node of parent cursor " + describe(parent));
    }

    private static String describe(EngineCursor cursor) {
        if (cursor.isNull()) {
            return "<null cursor>";
        }
        return cursor.kind() + "(" + cursor.spelling() + ")";
    }
}
