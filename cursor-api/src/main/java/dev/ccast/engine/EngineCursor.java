package dev.ccast.engine;

/**
 * Opaque handle identifying one construct in a parsed translation unit.
 *
 * <p>Cursors are only valid while the {@link EngineSession} that produced them is open. Two cursors for the same
 * construct are not guaranteed to be the same object, nor to be {@code equals}; callers that need to re-identify a
 * cursor across callbacks must derive their own key from {@link #kind()}, {@link #extent()} or {@link #hash()}.
 */
public interface EngineCursor {

    /** Null cursors mark absent optional children; every other accessor is undefined on them. */
    boolean isNull();

    /** The textual category of the construct, e.g. {@code function_definition}. */
    String kind();

    /** Human readable name of the construct, or the empty string when it has none. */
    String spelling();

    /** Where the construct begins. */
    SourceLocation location();

    SourceRange extent();

    /** Engine-computed 32-bit hash. Not guaranteed stable across engine versions, nor collision-free. */
    int hash();

    /** Display form of {@link #kind()}, computed on demand. */
    String prettyKind();

    /** The source text covered by {@link #extent()}. */
    String sourceText();

    /** The cursor of the construct that defines the symbol this cursor names, or a null cursor. */
    EngineCursor definition();

    /**
     * Walks the descendants of this cursor depth-first, calling {@code visitor} for each one. The visitor result controls
     * whether the engine descends into the current cursor, skips to its next sibling, or stops altogether.
     */
    void visitChildren(CursorVisitor visitor);
}
