package dev.ccast.treesitter;

import static dev.ccast.treesitter.CNodeTypes.*;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Computes the human readable name of a node: the declared name for declarations and definitions, the callee for
 * calls, the token text for names and literals, and the empty string for everything else.
 */
final class CSpelling {
    private static final List<String> NAME_CARRYING_FIELDS = List.of(FIELD_DECLARATOR, FIELD_NAME, "field");

    private CSpelling() {}

    static String of(TSNode node, byte[] source) {
        var type = node.getType();
        if (isToken(node) || type.endsWith("_literal")) {
            return NodeText.of(node, source);
        }
        if (CALL_EXPRESSION.equals(type)) {
            return nameOf(node.getChildByFieldName(FIELD_FUNCTION), source);
        }
        return declaredName(node, source);
    }

    private static String declaredName(TSNode node, byte[] source) {
        for (var field : NAME_CARRYING_FIELDS) {
            var child = node.getChildByFieldName(field);
            if (child != null && !child.isNull()) {
                return nameOf(child, source);
            }
        }
        return "";
    }

    /** Follows declarator chains ({@code *p}, {@code f(...)}, {@code x = 1}) down to the name they wrap. */
    private static String nameOf(@Nullable TSNode node, byte[] source) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (isToken(node)) {
            return NodeText.of(node, source);
        }
        return declaredName(node, source);
    }

    private static boolean isToken(TSNode node) {
        return NAME_TYPES.contains(node.getType()) || node.getChildCount() == 0;
    }
}
