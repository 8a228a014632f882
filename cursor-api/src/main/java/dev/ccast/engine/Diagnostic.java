package dev.ccast.engine;

import java.util.Locale;
import java.util.Objects;

/** A single message the engine produced while parsing. */
public record Diagnostic(Severity severity, SourceLocation location, String spelling) {

    public enum Severity {
        WARNING,
        ERROR,
        FATAL
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(spelling, "spelling");
    }

    /** Formats the diagnostic the way compilers print them: {@code file:line:col: error: message}. */
    @Override
    public String toString() {
        return location + ": " + severity.name().toLowerCase(Locale.ROOT) + ": " + spelling;
    }
}
