package dev.ccast.tree;

import java.util.Objects;

/**
 * Key re-identifying a traversal position within one build pass. Fingerprints of different strategies never match.
 */
public record Fingerprint(FingerprintStrategy strategy, String value) {

    public Fingerprint {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
