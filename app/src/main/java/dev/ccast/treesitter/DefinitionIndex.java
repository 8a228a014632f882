package dev.ccast.treesitter;

import static dev.ccast.treesitter.CNodeTypes.*;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Name to defining node, for one translation unit. The first definition in source order wins. Purely syntactic: no
 * scopes, so a local and a global of the same name resolve to whichever is defined first.
 */
final class DefinitionIndex {
    private final Map<String, TSNode> definitions;

    private DefinitionIndex(Map<String, TSNode> definitions) {
        this.definitions = definitions;
    }

    static DefinitionIndex build(TSNode root, byte[] source) {
        var definitions = new HashMap<String, TSNode>();
        var pending = new ArrayDeque<TSNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (isDefinition(node)) {
                var name = CSpelling.of(node, source);
                if (!name.isEmpty()) {
                    definitions.putIfAbsent(name, node);
                }
            }
            // push in reverse so that children pop in source order
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                var child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    pending.push(child);
                }
            }
        }
        return new DefinitionIndex(definitions);
    }

    /** The definition of the symbol {@code node} declares or references, or null if there is none. */
    @Nullable
    TSNode find(TSNode node, byte[] source) {
        if (isDefinition(node)) {
            return node;
        }
        var type = node.getType();
        if (NAME_TYPES.contains(type) || CALL_EXPRESSION.equals(type) || TAG_SPECIFIERS.contains(type)) {
            var name = CSpelling.of(node, source);
            return name.isEmpty() ? null : definitions.get(name);
        }
        return null;
    }

    int size() {
        return definitions.size();
    }

    private static boolean isDefinition(TSNode node) {
        var type = node.getType();
        if (DEFINITION_TYPES.contains(type)) {
            return true;
        }
        if (TAG_SPECIFIERS.contains(type)) {
            var body = node.getChildByFieldName(FIELD_BODY);
            return body != null && !body.isNull();
        }
        return false;
    }
}
