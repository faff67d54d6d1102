package com.cheflink.agent.kitchen;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Search results keyed by query. Concurrent lookups of the same query compute
 * it once; entries expire after a fixed time since they were written.
 */
@Slf4j
public class RecipeSearchCache {

    private final RecipeCatalog catalog;
    private final Cache<RecipeQuery, List<Recipe>> cache;

    public RecipeSearchCache(RecipeCatalog catalog, Duration ttl, long maxEntries) {
        this(catalog, ttl, maxEntries, Ticker.systemTicker());
    }

    RecipeSearchCache(RecipeCatalog catalog, Duration ttl, long maxEntries, Ticker ticker) {
        this.catalog = catalog;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    public List<Recipe> search(RecipeQuery query) {
        return cache.get(query, q -> {
            log.debug("Recipe search cache miss: {}", q);
            return List.copyOf(catalog.search(q));
        });
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long hitCount() {
        return cache.stats().hitCount();
    }
}
