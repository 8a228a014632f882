package dev.ccast.tree;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Indented dump of a tree, one line per node, one tab per level. Reads cached fields only, so it works after the
 * session is closed.
 */
public final class TreePrinter {

    private TreePrinter() {}

    /** Prints kinds only to standard output. */
    public static void printTree(Node root) {
        printTree(root, System.out);
    }

    public static void printTree(Node root, PrintStream out) {
        out.print(render(root, false));
        out.flush();
    }

    public static void printTree(Node root, PrintWriter out, boolean verbose) {
        out.print(render(root, verbose));
        out.flush();
    }

    public static String render(Node root) {
        return render(root, false);
    }

    /** With {@code verbose}, each line also carries the spelling (when there is one) and the location. */
    public static String render(Node root, boolean verbose) {
        var sb = new StringBuilder();
        TreeWalker.walkWithDepth(root, (node, depth) -> {
            sb.append("\t".repeat(depth)).append(node.kind());
            if (verbose) {
                if (!node.spelling().isEmpty()) {
                    sb.append(" '").append(node.spelling()).append('\'');
                }
                sb.append(" <").append(node.location()).append('>');
            }
            sb.append('\n');
        });
        return sb.toString();
    }
}
