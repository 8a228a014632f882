package dev.ccast;

import com.google.common.base.Splitter;
import dev.ccast.tree.FingerprintStrategy;
import dev.ccast.tree.TraversalPolicy;
import dev.ccast.treesitter.CDialect;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings for building trees. Read from {@code ccast.properties} on the classpath when present, then from system
 * properties with the same keys; a value that does not parse is logged and replaced by its default.
 *
 * @param maxDepth deepest level that is descended into; 0 means unlimited
 */
public record CcAstSettings(
        FingerprintStrategy fingerprintStrategy, CDialect defaultDialect, Set<String> skipKinds, int maxDepth) {
    private static final Logger logger = LogManager.getLogger(CcAstSettings.class);

    public static final String RESOURCE = "ccast.properties";
    public static final String KEY_FINGERPRINT = "ccast.fingerprint";
    public static final String KEY_DIALECT = "ccast.dialect";
    public static final String KEY_SKIP_KINDS = "ccast.skipKinds";
    public static final String KEY_MAX_DEPTH = "ccast.maxDepth";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public CcAstSettings {
        Objects.requireNonNull(fingerprintStrategy, "fingerprintStrategy");
        Objects.requireNonNull(defaultDialect, "defaultDialect");
        skipKinds = Set.copyOf(skipKinds);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
        }
    }

    public static CcAstSettings defaults() {
        return new CcAstSettings(FingerprintStrategy.STRUCTURAL, CDialect.C, Set.of(), 0);
    }

    /** Classpath resource overlaid with system properties. */
    public static CcAstSettings load() {
        var properties = new Properties();
        try (InputStream in = CcAstSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warn("Unable to read {} from the classpath, using defaults: {}", RESOURCE, e.getMessage());
        }
        for (var key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("ccast.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    public static CcAstSettings fromProperties(Properties properties) {
        var defaults = defaults();

        var fingerprint = defaults.fingerprintStrategy();
        var fingerprintValue = properties.getProperty(KEY_FINGERPRINT);
        if (fingerprintValue != null && !fingerprintValue.isBlank()) {
            try {
                fingerprint = FingerprintStrategy.valueOf(fingerprintValue.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}='{}', using {}", KEY_FINGERPRINT, fingerprintValue, fingerprint);
            }
        }

        var dialect = defaults.defaultDialect();
        var dialectValue = properties.getProperty(KEY_DIALECT);
        if (dialectValue != null && !dialectValue.isBlank()) {
            try {
                dialect = CDialect.parse(dialectValue);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}='{}', using {}", KEY_DIALECT, dialectValue, dialect);
            }
        }

        var skipKinds = LIST_SPLITTER.splitToStream(properties.getProperty(KEY_SKIP_KINDS, ""))
                .collect(Collectors.toSet());

        int maxDepth = defaults.maxDepth();
        var maxDepthValue = properties.getProperty(KEY_MAX_DEPTH);
        if (maxDepthValue != null && !maxDepthValue.isBlank()) {
            try {
                maxDepth = Integer.parseInt(maxDepthValue.trim());
                if (maxDepth < 0) {
                    logger.warn("Invalid {}='{}', using unlimited depth", KEY_MAX_DEPTH, maxDepthValue);
                    maxDepth = 0;
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid {}='{}', using unlimited depth", KEY_MAX_DEPTH, maxDepthValue);
            }
        }

        return new CcAstSettings(fingerprint, dialect, skipKinds, maxDepth);
    }

    public CcAstSettings withFingerprintStrategy(FingerprintStrategy strategy) {
        return new CcAstSettings(strategy, defaultDialect, skipKinds, maxDepth);
    }

    public CcAstSettings withDefaultDialect(CDialect dialect) {
        return new CcAstSettings(fingerprintStrategy, dialect, skipKinds, maxDepth);
    }

    public CcAstSettings withSkipKinds(Set<String> kinds) {
        return new CcAstSettings(fingerprintStrategy, defaultDialect, kinds, maxDepth);
    }

    public CcAstSettings withMaxDepth(int depth) {
        return new CcAstSettings(fingerprintStrategy, defaultDialect, skipKinds, depth);
    }

    /** Policy combining {@link #skipKinds()} and {@link #maxDepth()}. */
    public TraversalPolicy traversalPolicy() {
        var policy = TraversalPolicy.recurseAll();
        if (!skipKinds.isEmpty()) {
            policy = policy.and(TraversalPolicy.skipKinds(skipKinds));
        }
        if (maxDepth > 0) {
            policy = policy.and(TraversalPolicy.maxDepth(maxDepth));
        }
        return policy;
    }
}
