package dev.ccast.engine;

import java.nio.file.Path;
import java.util.List;

/** Entry point of a C/C++ parsing engine. */
public interface ParseEngine {

    /**
     * Parses {@code path} synchronously.
     *
     * @param arguments compiler-style arguments (include paths, defines, language flags), passed through verbatim
     * @throws ParseFailureException when no translation unit can be constructed at all. Recoverable problems in the
     *     source are reported through {@link EngineSession#diagnostics()} instead.
     */
    EngineSession open(Path path, List<String> arguments) throws ParseFailureException;
}
