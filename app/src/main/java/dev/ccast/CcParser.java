package dev.ccast;

import dev.ccast.engine.ParseEngine;
import dev.ccast.engine.ParseFailureException;
import dev.ccast.tree.DiagnosticsCollector;
import dev.ccast.tree.IdentityResolver;
import dev.ccast.tree.ParseResult;
import dev.ccast.tree.ParseSession;
import dev.ccast.tree.ParsedFile;
import dev.ccast.tree.TreeBuilder;
import dev.ccast.treesitter.TreeSitterEngine;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parses C and C++ files into trees.
 *
 * <p>Two lifetimes are on offer. {@link #parseFile} closes the engine session before it returns: the tree's cached
 * fields are all there is, and reading a node handle throws. {@link #open} keeps the session open inside a {@link
 * ParsedFile} that the caller closes, typically with try-with-resources.
 *
 * <p>Diagnostics never prevent a tree from being returned. Only a file the engine cannot parse at all raises {@link
 * ParseFailureException}.
 */
public final class CcParser {
    private static final Logger logger = LogManager.getLogger(CcParser.class);

    private final ParseEngine engine;
    private final CcAstSettings settings;

    /** Tree-sitter engine, settings from {@link CcAstSettings#load()}. */
    public CcParser() {
        this(CcAstSettings.load());
    }

    public CcParser(CcAstSettings settings) {
        this(new TreeSitterEngine(settings.defaultDialect()), settings);
    }

    public CcParser(ParseEngine engine, CcAstSettings settings) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CcAstSettings settings() {
        return settings;
    }

    public ParseResult parseFile(Path path, String... arguments) throws ParseFailureException {
        return parseFile(path, List.of(arguments));
    }

    public ParseResult parseFile(Path path, List<String> arguments) throws ParseFailureException {
        try (var parsed = open(path, arguments)) {
            return new ParseResult(parsed.root(), parsed.error());
        }
    }

    public ParsedFile open(Path path, String... arguments) throws ParseFailureException {
        return open(path, List.of(arguments));
    }

    public ParsedFile open(Path path, List<String> arguments) throws ParseFailureException {
        var session = ParseSession.open(engine, path, arguments);
        try {
            var error = DiagnosticsCollector.collect(session);
            var resolver = new IdentityResolver(settings.fingerprintStrategy());
            var root = new TreeBuilder(settings.traversalPolicy()).build(session, resolver);
            logger.debug("Parsed {}: root {}, {} diagnostic(s)", path, root.kind(), error.map(e -> e.size()).orElse(0));
            return new ParsedFile(session, root, error, resolver);
        } catch (RuntimeException | Error e) {
            session.close();
            throw e;
        }
    }
}
