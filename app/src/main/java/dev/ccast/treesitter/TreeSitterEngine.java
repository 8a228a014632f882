package dev.ccast.treesitter;

import dev.ccast.engine.EngineSession;
import dev.ccast.engine.ParseEngine;
import dev.ccast.engine.ParseFailureException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;

/**
 * {@link ParseEngine} backed by the tree-sitter C and C++ grammars.
 *
 * <p>Compiler arguments are accepted verbatim; only {@code -x} and {@code -std=} influence which grammar is used (see
 * {@link CDialect#resolve}). Tree-sitter does no preprocessing, so include paths and defines have no effect.
 */
public final class TreeSitterEngine implements ParseEngine {
    private static final Logger logger = LogManager.getLogger(TreeSitterEngine.class);

    private final CDialect defaultDialect;

    // TSParser is not threadsafe, so we keep one parser per thread and grammar
    private final Map<CDialect, ThreadLocal<TSParser>> parsers = new EnumMap<>(CDialect.class);

    public TreeSitterEngine() {
        this(CDialect.C);
    }

    /** @param defaultDialect grammar for headers and files whose extension does not name a language */
    public TreeSitterEngine(CDialect defaultDialect) {
        this.defaultDialect = Objects.requireNonNull(defaultDialect, "defaultDialect");
        for (var dialect : CDialect.values()) {
            parsers.put(dialect, ThreadLocal.withInitial(() -> createParser(dialect)));
        }
    }

    public CDialect defaultDialect() {
        return defaultDialect;
    }

    @Override
    public EngineSession open(Path path, List<String> arguments) throws ParseFailureException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(arguments, "arguments");

        byte[] bytes;
        try {
            bytes = NodeText.stripUtf8Bom(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new ParseFailureException(path, "unable to read source file (" + e + ")", e);
        }

        var dialect = CDialect.resolve(path, arguments, defaultDialect);
        if (!arguments.isEmpty()) {
            logger.debug(
                    "Arguments {} passed through for {}; the {} grammar does not preprocess", arguments, path, dialect);
        }

        TSParser parser;
        try {
            parser = parsers.get(dialect).get();
        } catch (IllegalStateException e) {
            throw new ParseFailureException(path, e.getMessage(), e);
        }

        // invalid UTF-8 decodes to U+FFFD, so the tree's offsets refer to the re-encoded text, not the file bytes
        var text = new String(bytes, StandardCharsets.UTF_8);
        var source = text.getBytes(StandardCharsets.UTF_8);

        long start = System.nanoTime();
        var tree = parser.parseString(null, text);
        if (tree == null || tree.getRootNode().isNull()) {
            throw new ParseFailureException(path, "the " + dialect + " grammar produced no translation unit");
        }
        logger.debug(
                "Parsed {} ({} bytes) as {} in {} ms",
                path,
                bytes.length,
                dialect,
                (System.nanoTime() - start) / 1_000_000);
        return new TreeSitterSession(path, arguments, dialect, source, tree);
    }

    private static TSParser createParser(CDialect dialect) {
        var parser = new TSParser();
        if (!parser.setLanguage(dialect.createLanguage())) {
            logger.error("Failed to set language on TSParser for {}", dialect);
            throw new IllegalStateException("tree-sitter rejected the " + dialect + " grammar");
        }
        return parser;
    }
}
