package dev.ccast.engine;

import java.util.Objects;

/**
 * A presumed source position as reported by the parsing engine. Lines and columns are 1-indexed; columns count bytes
 * of the UTF-8 encoded line.
 */
public record SourceLocation(String file, int line, int column) {

    public SourceLocation {
        Objects.requireNonNull(file, "file");
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must not be negative: " + line + ":" + column);
        }
    }

    /** Formats as {@code <file>:<line>:<col>}. */
    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
