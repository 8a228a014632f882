package dev.ccast.tree;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Folds the finalized diagnostic list of a session into one aggregate. Never aborts anything. */
public final class DiagnosticsCollector {
    private static final Logger logger = LogManager.getLogger(DiagnosticsCollector.class);

    private DiagnosticsCollector() {}

    /** Empty when the engine reported nothing. */
    public static Optional<DiagnosticsException> collect(ParseSession session) {
        var diagnostics = session.diagnostics();
        if (diagnostics.isEmpty()) {
            return Optional.empty();
        }
        diagnostics.forEach(d -> logger.debug("{}", d));
        logger.warn("{} diagnostic(s) while parsing {}", diagnostics.size(), session.path());
        return Optional.of(new DiagnosticsException(session.path(), diagnostics));
    }
}
