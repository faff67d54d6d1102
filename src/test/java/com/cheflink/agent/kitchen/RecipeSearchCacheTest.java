package com.cheflink.agent.kitchen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeSearchCacheTest {

    @Mock RecipeCatalog catalog;

    private final AtomicLong nanos = new AtomicLong();

    @Test
    void equalQueries_hitCatalogOnce() {
        when(catalog.search(any())).thenReturn(List.of());
        RecipeSearchCache cache = new RecipeSearchCache(catalog, Duration.ofMinutes(10), 100, nanos::get);

        cache.search(RecipeQuery.builder().text("curry").build());
        cache.search(RecipeQuery.builder().text("curry").build());

        verify(catalog, times(1)).search(any());
        assertThat(cache.hitCount()).isEqualTo(1);
    }

    @Test
    void entries_expireAfterTtl() {
        when(catalog.search(any())).thenReturn(List.of());
        RecipeSearchCache cache = new RecipeSearchCache(catalog, Duration.ofMinutes(10), 100, nanos::get);
        RecipeQuery query = RecipeQuery.builder().text("salmon").build();

        cache.search(query);
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(11));
        cache.search(query);

        verify(catalog, times(2)).search(query);
    }

    @Test
    void invalidateAll_forcesReload() {
        when(catalog.search(any())).thenReturn(List.of());
        RecipeSearchCache cache = new RecipeSearchCache(catalog, Duration.ofMinutes(10), 100, nanos::get);
        RecipeQuery query = RecipeQuery.builder().build();

        cache.search(query);
        cache.invalidateAll();
        cache.search(query);

        verify(catalog, times(2)).search(query);
    }
}
