package dev.ccast.treesitter;

import static dev.ccast.treesitter.CNodeTypes.ERROR;

import dev.ccast.engine.Diagnostic;
import dev.ccast.engine.SourceLocation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Derives diagnostics from a tree-sitter syntax tree. Tree-sitter recovers from every error, leaving {@code ERROR}
 * nodes for input it had to skip and zero-width missing nodes for tokens it had to invent; each becomes one diagnostic,
 * in source order. Subtrees without errors are not scanned.
 */
final class SyntaxDiagnostics {
    private static final int EXCERPT_LENGTH = 32;

    private SyntaxDiagnostics() {}

    static List<Diagnostic> collect(TSNode root, byte[] source, String file) {
        var diagnostics = new ArrayList<Diagnostic>();
        var pending = new ArrayDeque<TSNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node.isMissing()) {
                diagnostics.add(error(node, file, "expected '" + node.getType() + "'"));
                continue;
            }
            if (ERROR.equals(node.getType())) {
                var text = NodeText.excerpt(NodeText.of(node, source).strip(), EXCERPT_LENGTH);
                var message = text.isEmpty() ? "syntax error" : "syntax error, unexpected '" + text + "'";
                diagnostics.add(error(node, file, message));
                continue;
            }
            if (!node.hasError()) {
                continue;
            }
            // push in reverse so that children pop in source order
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                var child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    pending.push(child);
                }
            }
        }
        return diagnostics;
    }

    private static Diagnostic error(TSNode node, String file, String message) {
        var start = node.getStartPoint();
        var location = new SourceLocation(file, start.getRow() + 1, start.getColumn() + 1);
        return new Diagnostic(Diagnostic.Severity.ERROR, location, message);
    }
}
