package dev.ccast.tree;

import dev.ccast.engine.EngineCursor;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps engine cursors to the nodes already materialized for them. Bound to one {@link FingerprintStrategy} for its
 * whole life and to one build pass; create a new resolver for every session.
 *
 * <p>When a fingerprint is registered twice the newer node wins: the engine visits the newer cursor's children next,
 * and they have to find it. The collision is counted and logged.
 */
public final class IdentityResolver {
    private static final Logger logger = LogManager.getLogger(IdentityResolver.class);

    private final FingerprintStrategy strategy;
    private final Map<Fingerprint, Node> nodes = new HashMap<>();
    private int collisions;

    public IdentityResolver(FingerprintStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public FingerprintStrategy strategy() {
        return strategy;
    }

    public void register(EngineCursor cursor, Node node) {
        var fingerprint = strategy.fingerprint(cursor);
        var previous = nodes.put(fingerprint, node);
        if (previous != null && previous != node) {
            collisions++;
            logger.warn("Fingerprint collision on {}: {} replaces {}", fingerprint, node, previous);
        }
    }

    public Optional<Node> lookup(EngineCursor cursor) {
        return lookup(strategy.fingerprint(cursor));
    }

    public Optional<Node> lookup(Fingerprint fingerprint) {
        if (fingerprint.strategy() != strategy) {
            throw new IllegalArgumentException("Fingerprint " + fingerprint + " was computed with "
                    + fingerprint.strategy() + " but this resolver uses " + strategy);
        }
        return Optional.ofNullable(nodes.get(fingerprint));
    }

    public int size() {
        return nodes.size();
    }

    /** Number of registrations that replaced a different node under the same fingerprint. */
    public int collisions() {
        return collisions;
    }
}
