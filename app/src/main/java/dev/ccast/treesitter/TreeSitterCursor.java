package dev.ccast.treesitter;

import com.google.common.base.CaseFormat;
import dev.ccast.engine.ChildVisitResult;
import dev.ccast.engine.CursorVisitor;
import dev.ccast.engine.EngineCursor;
import dev.ccast.engine.SourceLocation;
import dev.ccast.engine.SourceRange;
import java.util.ArrayDeque;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

/**
 * Cursor over one named tree-sitter node. Anonymous nodes (punctuation, keywords) are never visited. A fresh cursor
 * object is created for every visit, so identity is meaningless; see {@link #hash()}.
 */
final class TreeSitterCursor implements EngineCursor {
    private final TreeSitterSession session;
    private final @Nullable TSNode node;
    private final boolean root;

    TreeSitterCursor(TreeSitterSession session, @Nullable TSNode node, boolean root) {
        this.session = session;
        this.node = node;
        this.root = root;
    }

    @Override
    public boolean isNull() {
        return node == null || node.isNull();
    }

    @Override
    public String kind() {
        return node().getType();
    }

    /** The root spells as the file name, like a clang translation unit. */
    @Override
    public String spelling() {
        var n = node();
        return root ? session.fileName() : CSpelling.of(n, session.source());
    }

    @Override
    public SourceLocation location() {
        return toLocation(node().getStartPoint());
    }

    @Override
    public SourceRange extent() {
        var n = node();
        return new SourceRange(toLocation(n.getStartPoint()), toLocation(n.getEndPoint()));
    }

    @Override
    public int hash() {
        var n = node();
        int h = n.getType().hashCode();
        h = 31 * h + n.getStartByte();
        h = 31 * h + n.getEndByte();
        return h;
    }

    @Override
    public String prettyKind() {
        var n = node();
        var pretty = CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, n.getType());
        return n.isMissing() ? "Missing" + pretty : pretty;
    }

    @Override
    public String sourceText() {
        return NodeText.of(node(), session.source());
    }

    @Override
    public EngineCursor definition() {
        var definition = session.definitions().find(node(), session.source());
        return new TreeSitterCursor(session, definition, false);
    }

    /** Depth-first over named descendants, with an explicit stack so that deeply nested expressions fit. */
    @Override
    public void visitChildren(CursorVisitor visitor) {
        var frames = new ArrayDeque<Frame>();
        frames.push(new Frame(this));
        while (!frames.isEmpty()) {
            var frame = frames.peek();
            var parentNode = frame.cursor.node();
            if (frame.next >= parentNode.getNamedChildCount()) {
                frames.pop();
                continue;
            }
            var child = new TreeSitterCursor(session, parentNode.getNamedChild(frame.next++), false);
            var result = visitor.visit(child, frame.cursor);
            if (result == ChildVisitResult.BREAK) {
                return;
            }
            if (result == ChildVisitResult.RECURSE && !child.isNull()) {
                frames.push(new Frame(child));
            }
        }
    }

    /** A cursor whose named children are being enumerated, and the index of the next one. */
    private static final class Frame {
        private final TreeSitterCursor cursor;
        private int next;

        Frame(TreeSitterCursor cursor) {
            this.cursor = cursor;
        }
    }

    private TSNode node() {
        session.ensureOpen();
        var n = node;
        if (n == null || n.isNull()) {
            throw new IllegalStateException("Null cursor has no contents");
        }
        return n;
    }

    private SourceLocation toLocation(TSPoint point) {
        return new SourceLocation(session.fileName(), point.getRow() + 1, point.getColumn() + 1);
    }

    @Override
    public String toString() {
        if (!session.isOpen()) {
            return "TreeSitterCursor[disposed]";
        }
        return isNull() ? "TreeSitterCursor[null]" : "TreeSitterCursor[" + kind() + " @ " + location() + "]";
    }
}
