package com.di.docsync.schema;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Holds the current {@link SchemaMap} so runs reuse one discovery until it expires or an operator
 * asks for rediscovery. A map is only ever replaced, never edited.
 */
public class SchemaMapCache {

    private static final String KEY = "current";

    private final Cache<String, SchemaMap> cache;

    public SchemaMapCache(Duration ttl) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .build();
    }

    /** Cached map, discovering through {@code loader} when absent or expired. */
    public SchemaMap get(Supplier<SchemaMap> loader) {
        return cache.get(KEY, k -> loader.get());
    }

    public Optional<SchemaMap> current() {
        return Optional.ofNullable(cache.getIfPresent(KEY));
    }

    public void put(SchemaMap map) {
        cache.put(KEY, map);
    }

    public void invalidate() {
        cache.invalidate(KEY);
    }
}
