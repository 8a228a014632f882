package dev.ccast.tree;

import dev.ccast.engine.ChildVisitResult;
import dev.ccast.engine.EngineCursor;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns the engine's push-style visitation into an owned tree.
 *
 * <p>The engine calls back with {@code (cursor, parent)} pairs in depth-first pre-order. The parent's node is found
 * through an {@link IdentityResolver}, the new node is registered under its own fingerprint so that its children can
 * find it in turn, and it is appended to the parent's children. Visitation order is therefore preserved among
 * siblings.
 *
 * <p>A parent that was never registered means the engine broke its traversal contract; the build fails with {@link
 * CursorContractViolationException} rather than dropping or misattaching the child.
 */
public final class TreeBuilder {
    private static final Logger logger = LogManager.getLogger(TreeBuilder.class);

    private final TraversalPolicy policy;

    public TreeBuilder() {
        this(TraversalPolicy.recurseAll());
    }

    public TreeBuilder(TraversalPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** Builds with a fresh {@link FingerprintStrategy#STRUCTURAL} resolver. */
    public Node build(ParseSession session) {
        return build(session, new IdentityResolver(FingerprintStrategy.STRUCTURAL));
    }

    /**
     * Builds the tree for {@code session}. {@code resolver} must be empty; after the call it indexes every node of the
     * returned tree.
     */
    public Node build(ParseSession session, IdentityResolver resolver) {
        if (resolver.size() != 0) {
            throw new IllegalArgumentException("IdentityResolver is already populated; use one per build pass");
        }
        session.beginTraversal();
        try {
            var rootCursor = session.rootCursor();
            var root = Node.materialize(rootCursor, session, 0);
            resolver.register(rootCursor, root);

            rootCursor.visitChildren((cursor, parent) -> visit(session, resolver, cursor, parent));

            TreeWalker.walk(root, Node::freeze);
            logger.debug(
                    "Built tree for {}: {} nodes, {} fingerprint collisions ({})",
                    session.path(),
                    resolver.size(),
                    resolver.collisions(),
                    resolver.strategy());
            return root;
        } finally {
            session.endTraversal();
        }
    }

    private ChildVisitResult visit(
            ParseSession session, IdentityResolver resolver, EngineCursor cursor, EngineCursor parent) {
        if (cursor.isNull()) {
            return ChildVisitResult.CONTINUE;
        }
        var parentNode = resolver.lookup(parent).orElseThrow(() -> new CursorContractViolationException(parent));

        int depth = parentNode.depth() + 1;
        var decision = policy.decide(cursor, depth);
        if (decision == TraversalPolicy.Decision.DROP) {
            return ChildVisitResult.CONTINUE;
        }

        var node = Node.materialize(cursor, session, depth);
        resolver.register(cursor, node);
        parentNode.addChild(node);
        return decision == TraversalPolicy.Decision.DESCEND ? ChildVisitResult.RECURSE : ChildVisitResult.CONTINUE;
    }
}
