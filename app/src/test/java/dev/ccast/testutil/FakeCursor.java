package dev.ccast.testutil;

import dev.ccast.engine.ChildVisitResult;
import dev.ccast.engine.CursorVisitor;
import dev.ccast.engine.EngineCursor;
import dev.ccast.engine.SourceLocation;
import dev.ccast.engine.SourceRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Programmable cursor. Children are visited with clang semantics. Every accessor counts its calls and fails once the
 * owning {@link FakeEngine.FakeSession} is closed, so tests can see whether the engine was touched.
 */
public final class FakeCursor implements EngineCursor {
    public static final String FILE = "fake.c";

    private final @Nullable String kind;
    private final String spelling;
    private final SourceLocation location;
    private final SourceRange extent;
    private final List<FakeCursor> children = new ArrayList<>();
    private int hash;
    private @Nullable EngineCursor reportedParent;
    private @Nullable EngineCursor definition;
    private @Nullable FakeEngine.FakeSession session;
    private @Nullable Error visitFailure;
    private int reads;

    private FakeCursor(@Nullable String kind, String spelling, int line, int column) {
        this.kind = kind;
        this.spelling = spelling;
        this.location = new SourceLocation(FILE, line, column);
        this.extent = new SourceRange(location, new SourceLocation(FILE, line, column + Math.max(1, spelling.length())));
        this.hash = Objects.hash(kind, line, column);
    }

    public static FakeCursor of(String kind, String spelling, int line, int column) {
        return new FakeCursor(kind, spelling, line, column);
    }

    public static FakeCursor nullCursor() {
        return new FakeCursor(null, "", 0, 0);
    }

    public FakeCursor children(FakeCursor... kids) {
        children.addAll(List.of(kids));
        return this;
    }

    /** Makes the enclosing cursor report {@code parent} instead of itself when visiting this cursor. */
    public FakeCursor reportedParent(EngineCursor parent) {
        this.reportedParent = parent;
        return this;
    }

    public FakeCursor hash(int value) {
        this.hash = value;
        return this;
    }

    public FakeCursor definedBy(EngineCursor cursor) {
        this.definition = cursor;
        return this;
    }

    /** {@link #visitChildren} throws {@code error} instead of visiting. */
    public FakeCursor failOnVisit(Error error) {
        this.visitFailure = error;
        return this;
    }

    void attach(FakeEngine.FakeSession owner) {
        this.session = owner;
        children.forEach(c -> c.attach(owner));
    }

    public int reads() {
        return reads;
    }

    @Override
    public boolean isNull() {
        return kind == null;
    }

    @Override
    public String kind() {
        read();
        return Objects.requireNonNull(kind, "null cursor");
    }

    @Override
    public String spelling() {
        read();
        return spelling;
    }

    @Override
    public SourceLocation location() {
        read();
        return location;
    }

    @Override
    public SourceRange extent() {
        read();
        return extent;
    }

    @Override
    public int hash() {
        read();
        return hash;
    }

    @Override
    public String prettyKind() {
        return "Fake:" + kind();
    }

    @Override
    public String sourceText() {
        return spelling();
    }

    @Override
    public EngineCursor definition() {
        read();
        return definition != null ? definition : nullCursor();
    }

    @Override
    public void visitChildren(CursorVisitor visitor) {
        read();
        if (visitFailure != null) {
            throw visitFailure;
        }
        visit(this, visitor);
    }

    private static boolean visit(FakeCursor parent, CursorVisitor visitor) {
        for (var child : parent.children) {
            var reported = child.reportedParent != null ? child.reportedParent : parent;
            var result = visitor.visit(child, reported);
            if (result == ChildVisitResult.BREAK) {
                return false;
            }
            if (result == ChildVisitResult.RECURSE && !child.isNull() && !visit(child, visitor)) {
                return false;
            }
        }
        return true;
    }

    private void read() {
        if (session != null && session.isClosed()) {
            throw new IllegalStateException("fake session is closed");
        }
        reads++;
    }

    @Override
    public String toString() {
        return isNull() ? "FakeCursor[null]" : "FakeCursor[" + kind + " '" + spelling + "' " + location + "]";
    }
}
