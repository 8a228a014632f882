package dev.ccast.engine;

import java.util.Objects;

/** The extent of a cursor in its file. {@code end} is exclusive. */
public record SourceRange(SourceLocation start, SourceLocation end) {

    public SourceRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    @Override
    public String toString() {
        return start + "-" + end.line() + ":" + end.column();
    }
}
