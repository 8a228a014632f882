package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;
import java.util.Set;

/** Decides, per visited cursor, whether the {@link TreeBuilder} keeps it and whether it descends into it. */
@FunctionalInterface
public interface TraversalPolicy {

    enum Decision {
        /** Materialize the cursor and visit its children. */
        DESCEND,
        /** Materialize the cursor but not its children. */
        LEAF,
        /** Leave the cursor and its whole subtree out of the tree. */
        DROP
    }

    /**
     * @param depth the depth the node would have; children of the root are at depth 1
     */
    Decision decide(EngineCursor cursor, int depth);

    static TraversalPolicy recurseAll() {
        return (cursor, depth) -> Decision.DESCEND;
    }

    /** Nodes at {@code maxDepth} are kept but not descended into. */
    static TraversalPolicy maxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        return (cursor, depth) -> depth >= maxDepth ? Decision.LEAF : Decision.DESCEND;
    }

    static TraversalPolicy skipKinds(Set<String> kinds) {
        var skipped = Set.copyOf(kinds);
        return (cursor, depth) -> skipped.contains(cursor.kind()) ? Decision.DROP : Decision.DESCEND;
    }

    /** The more restrictive of the two decisions: DROP over LEAF over DESCEND. */
    default TraversalPolicy and(TraversalPolicy other) {
        return (cursor, depth) -> {
            var first = decide(cursor, depth);
            if (first == Decision.DROP) {
                return Decision.DROP;
            }
            var second = other.decide(cursor, depth);
            if (second == Decision.DROP) {
                return Decision.DROP;
            }
            return first == Decision.LEAF || second == Decision.LEAF ? Decision.LEAF : Decision.DESCEND;
        };
    }
}
