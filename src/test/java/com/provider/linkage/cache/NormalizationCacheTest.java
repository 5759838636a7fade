package com.provider.linkage.cache;

import com.provider.linkage.rules.NameNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationCacheTest {

    private final NameNormalizer normalizer = new NameNormalizer();

    @Nested
    @DisplayName("Enabled cache")
    class EnabledTests {

        @Test
        @DisplayName("Should return the same result as the normalizer")
        void testMatchesNormalizer() {
            try (NormalizationCache cache = new NormalizationCache(normalizer, CacheConfig.defaults())) {
                String raw = "Sunrise Family Health Center, Inc.";
                assertEquals(normalizer.normalizeName(raw), cache.normalizeName(raw));
            }
        }

        @Test
        @DisplayName("Should serve repeated names from the cache")
        void testHits() {
            try (NormalizationCache cache = new NormalizationCache(normalizer, CacheConfig.defaults())) {
                cache.normalizeName("Valley Care Clinic");
                cache.normalizeName("Valley Care Clinic");
                cache.normalizeName("Harbor Clinic");

                assertEquals(1, cache.hitCount());
                assertEquals(2, cache.estimatedSize());
            }
        }

        @Test
        @DisplayName("Should map null to the empty string")
        void testNull() {
            try (NormalizationCache cache = new NormalizationCache(normalizer, CacheConfig.defaults())) {
                assertEquals("", cache.normalizeName(null));
            }
        }

        @Test
        @DisplayName("invalidateAll should drop every entry")
        void testInvalidateAll() {
            NormalizationCache cache = new NormalizationCache(normalizer, CacheConfig.defaults());
            cache.normalizeName("Valley Care Clinic");

            cache.invalidateAll();

            assertEquals(0, cache.estimatedSize());
        }
    }

    @Nested
    @DisplayName("Disabled cache")
    class DisabledTests {

        @Test
        @DisplayName("Should normalize without storing anything")
        void testPassThrough() {
            try (NormalizationCache cache = new NormalizationCache(normalizer, CacheConfig.disabled())) {
                String first = cache.normalizeName("Valley Care Clinic");
                String second = cache.normalizeName("Valley Care Clinic");

                assertEquals(first, second);
                assertEquals(0, cache.hitCount());
                assertEquals(0, cache.estimatedSize());
            }
        }
    }

    @Test
    @DisplayName("A non-positive size should be rejected")
    void testInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, true));
    }
}
