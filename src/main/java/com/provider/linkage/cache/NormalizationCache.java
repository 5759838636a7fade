package com.provider.linkage.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.provider.linkage.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed memo of normalized names, owned by exactly one pipeline run.
 *
 * <p>Names repeat heavily across registry, claims and cost-report files, so the run normalizes
 * each distinct raw name once. The cache is never shared between runs: it is cleared when the
 * run starts and again when the run closes.</p>
 */
public class NormalizationCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NormalizationCache.class);

    private final NameNormalizer normalizer;
    private final Cache<String, String> cache;
    private final boolean enabled;

    public NormalizationCache(NameNormalizer normalizer, CacheConfig config) {
        this.normalizer = normalizer;
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
    }

    /**
     * Returns the normalized form of {@code raw}, computing it on first use within the run.
     */
    public String normalizeName(String raw) {
        if (raw == null) {
            return "";
        }
        if (!enabled) {
            return normalizer.normalizeName(raw);
        }
        return cache.get(raw, normalizer::normalizeName);
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * Drops every entry. Called at the start of a run so nothing computed earlier is served.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    @Override
    public void close() {
        log.debug("cache.closed hits={} misses={} size={}",
                cache.stats().hitCount(), cache.stats().missCount(), cache.estimatedSize());
        cache.invalidateAll();
    }
}
