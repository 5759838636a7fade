package com.provider.linkage.cache;

/**
 * Configuration for run-scoped caches.
 *
 * @param maxSize maximum number of entries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 200,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(200_000, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
