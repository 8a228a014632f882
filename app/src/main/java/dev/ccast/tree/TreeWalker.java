package dev.ccast.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Pre-order traversals over a built tree. None of these touch the engine. They use an explicit stack, so trees as deep
 * as the engine can produce are fine.
 */
public final class TreeWalker {

    private TreeWalker() {}

    private record Pending(Node node, int depth) {}

    /** Calls {@code fn} for every node, parent before children, siblings in stored order. */
    public static void walk(Node root, Consumer<Node> fn) {
        walkWithDepth(root, (node, depth) -> fn.accept(node));
    }

    /** Like {@link #walk} but also passes the depth relative to {@code root}. */
    public static void walkWithDepth(Node root, BiConsumer<Node, Integer> fn) {
        var pending = new ArrayDeque<Pending>();
        pending.push(new Pending(root, 0));
        while (!pending.isEmpty()) {
            var next = pending.pop();
            fn.accept(next.node(), next.depth());
            pushChildren(pending, next);
        }
    }

    public static int count(Node root) {
        int[] count = {0};
        walk(root, n -> count[0]++);
        return count[0];
    }

    /** First match in pre-order. */
    public static Optional<Node> find(Node root, Predicate<Node> predicate) {
        var pending = new ArrayDeque<Pending>();
        pending.push(new Pending(root, 0));
        while (!pending.isEmpty()) {
            var next = pending.pop();
            if (predicate.test(next.node())) {
                return Optional.of(next.node());
            }
            pushChildren(pending, next);
        }
        return Optional.empty();
    }

    public static List<Node> findAll(Node root, Predicate<Node> predicate) {
        var matches = new ArrayList<Node>();
        walk(root, n -> {
            if (predicate.test(n)) {
                matches.add(n);
            }
        });
        return matches;
    }

    // reversed, so that the first child is popped first
    private static void pushChildren(ArrayDeque<Pending> pending, Pending parent) {
        var children = parent.node().children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(new Pending(children.get(i), parent.depth() + 1));
        }
    }
}
