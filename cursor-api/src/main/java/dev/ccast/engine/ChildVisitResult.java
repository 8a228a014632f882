package dev.ccast.engine;

/** What the engine should do after a {@link CursorVisitor} returns. */
public enum ChildVisitResult {
    /** Terminate the whole traversal. */
    BREAK,
    /** Move on to the next sibling without visiting the children of the current cursor. */
    CONTINUE,
    /** Visit the children of the current cursor, then its next sibling. */
    RECURSE
}
