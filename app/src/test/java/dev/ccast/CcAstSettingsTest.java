package dev.ccast;

import static org.junit.jupiter.api.Assertions.*;

import dev.ccast.testutil.FakeCursor;
import dev.ccast.tree.FingerprintStrategy;
import dev.ccast.tree.TraversalPolicy.Decision;
import dev.ccast.treesitter.CDialect;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CcAstSettingsTest {

    private static Properties properties(String... keysAndValues) {
        var properties = new Properties();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
        }
        return properties;
    }

    @Test
    void testEmptyPropertiesGiveDefaults() {
        assertEquals(CcAstSettings.defaults(), CcAstSettings.fromProperties(new Properties()));
    }

    @Test
    void testAllKeysAreRead() {
        var settings = CcAstSettings.fromProperties(properties(
                CcAstSettings.KEY_FINGERPRINT, "engine_hash",
                CcAstSettings.KEY_DIALECT, "c++",
                CcAstSettings.KEY_SKIP_KINDS, " comment, preproc_include ,,",
                CcAstSettings.KEY_MAX_DEPTH, "3"));

        assertEquals(FingerprintStrategy.ENGINE_HASH, settings.fingerprintStrategy());
        assertEquals(CDialect.CPP, settings.defaultDialect());
        assertEquals(Set.of("comment", "preproc_include"), settings.skipKinds());
        assertEquals(3, settings.maxDepth());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        var settings = CcAstSettings.fromProperties(properties(
                CcAstSettings.KEY_FINGERPRINT, "md5",
                CcAstSettings.KEY_DIALECT, "rust",
                CcAstSettings.KEY_MAX_DEPTH, "deep"));

        assertEquals(CcAstSettings.defaults(), settings);
        assertEquals(0, CcAstSettings.fromProperties(properties(CcAstSettings.KEY_MAX_DEPTH, "-4")).maxDepth());
    }

    @Test
    void testBundledResourceMatchesDefaults() {
        // no ccast.* system properties are set by the build
        assertEquals(CcAstSettings.defaults(), CcAstSettings.load());
    }

    @Test
    void testTraversalPolicyCombinesSkipAndDepth() {
        var policy = CcAstSettings.defaults()
                .withSkipKinds(Set.of("comment"))
                .withMaxDepth(2)
                .traversalPolicy();

        assertEquals(Decision.DROP, policy.decide(FakeCursor.of("comment", "", 1, 1), 1));
        assertEquals(Decision.DESCEND, policy.decide(FakeCursor.of("declaration", "", 1, 1), 1));
        assertEquals(Decision.LEAF, policy.decide(FakeCursor.of("declaration", "", 1, 1), 2));
        assertEquals(Decision.DROP, policy.decide(FakeCursor.of("comment", "", 1, 1), 5));
    }

    @Test
    void testNegativeMaxDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CcAstSettings.defaults().withMaxDepth(-1));
    }
}
