package dev.ccast.treesitter;

import dev.ccast.engine.Diagnostic;
import dev.ccast.engine.EngineCursor;
import dev.ccast.engine.EngineSession;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSTree;

/**
 * One parsed file. Holds the syntax tree and the source bytes its offsets refer to; both are released by {@link
 * #close()}, after which every cursor of this session throws on access.
 */
final class TreeSitterSession implements EngineSession {
    private static final Logger logger = LogManager.getLogger(TreeSitterSession.class);

    private final Path path;
    private final List<String> arguments;
    private final CDialect dialect;
    private final List<Diagnostic> diagnostics;
    private byte[] source;
    private @Nullable TSTree tree;
    private @Nullable DefinitionIndex definitions;

    TreeSitterSession(Path path, List<String> arguments, CDialect dialect, byte[] source, TSTree tree) {
        this.path = path;
        this.arguments = List.copyOf(arguments);
        this.dialect = dialect;
        this.source = source;
        this.tree = tree;
        this.diagnostics = List.copyOf(SyntaxDiagnostics.collect(tree.getRootNode(), source, fileName()));
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public List<String> arguments() {
        return arguments;
    }

    CDialect dialect() {
        return dialect;
    }

    String fileName() {
        return path.toString();
    }

    byte[] source() {
        ensureOpen();
        return source;
    }

    boolean isOpen() {
        return tree != null;
    }

    void ensureOpen() {
        if (tree == null) {
            throw new IllegalStateException("Tree-sitter session for " + path + " has been disposed");
        }
    }

    @Override
    public EngineCursor rootCursor() {
        var t = tree;
        if (t == null) {
            throw new IllegalStateException("Tree-sitter session for " + path + " has been disposed");
        }
        return new TreeSitterCursor(this, t.getRootNode(), true);
    }

    @Override
    public List<Diagnostic> diagnostics() {
        ensureOpen();
        return diagnostics;
    }

    DefinitionIndex definitions() {
        var t = tree;
        if (t == null) {
            throw new IllegalStateException("Tree-sitter session for " + path + " has been disposed");
        }
        var index = definitions;
        if (index == null) {
            index = DefinitionIndex.build(t.getRootNode(), source);
            definitions = index;
            logger.trace("Indexed {} definitions in {}", index.size(), path);
        }
        return index;
    }

    @Override
    public void close() {
        if (tree == null) {
            return;
        }
        // the binding frees native tree memory once the TSTree is unreachable
        tree = null;
        definitions = null;
        source = new byte[0];
        logger.trace("Disposed tree-sitter session for {}", path);
    }
}
