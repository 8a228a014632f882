package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;
import dev.ccast.engine.SourceLocation;
import dev.ccast.engine.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One construct of the parsed source. {@link #kind()}, {@link #spelling()}, {@link #location()} and {@link #extent()}
 * are copied out of the engine when the node is created and remain valid after the session is closed. {@link
 * #handle()} aliases the session and does not.
 *
 * <p>Children are appended only by the {@link TreeBuilder} pass that created the node; once the pass completes the
 * node is frozen.
 */
public final class Node {
    private final String kind;
    private final String spelling;
    private final SourceLocation location;
    private final SourceRange extent;
    private final int depth;
    private final CursorHandle handle;
    private final List<Node> children = new ArrayList<>();
    private boolean frozen;

    private Node(
            String kind, String spelling, SourceLocation location, SourceRange extent, int depth, CursorHandle handle) {
        this.kind = kind;
        this.spelling = spelling;
        this.location = location;
        this.extent = extent;
        this.depth = depth;
        this.handle = handle;
    }

    static Node materialize(EngineCursor cursor, ParseSession session, int depth) {
        return new Node(
                cursor.kind(),
                cursor.spelling(),
                cursor.location(),
                cursor.extent(),
                depth,
                new CursorHandle(session, cursor));
    }

    public String kind() {
        return kind;
    }

    public String spelling() {
        return spelling;
    }

    public SourceLocation location() {
        return location;
    }

    public SourceRange extent() {
        return extent;
    }

    /** Distance from the root; the root is at depth 0. */
    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public CursorHandle handle() {
        return handle;
    }

    void addChild(Node child) {
        if (frozen) {
            throw new IllegalStateException(
                    "Node " + this + " is frozen; children can only be added while it is being built");
        }
        children.add(child);
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return kind + " '" + spelling + "' @ " + location;
    }
}
