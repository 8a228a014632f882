package dev.ccast.engine;

/**
 * Callback driven by {@link EngineCursor#visitChildren(CursorVisitor)}. The engine calls it serially, in depth-first
 * pre-order, never concurrently.
 */
@FunctionalInterface
public interface CursorVisitor {

    /**
     * @param cursor the cursor being visited; may be a null cursor (see {@link EngineCursor#isNull()})
     * @param parent the cursor whose children are being enumerated
     */
    ChildVisitResult visit(EngineCursor cursor, EngineCursor parent);
}
