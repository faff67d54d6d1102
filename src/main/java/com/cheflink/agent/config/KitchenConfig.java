package com.cheflink.agent.config;

import com.cheflink.agent.kitchen.RecipeCatalog;
import com.cheflink.agent.kitchen.RecipeSearchCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class KitchenConfig {

    @Bean
    public RecipeSearchCache recipeSearchCache(RecipeCatalog recipeCatalog,
                                               @Value("${kitchen.search-cache.ttl:PT10M}") Duration ttl,
                                               @Value("${kitchen.search-cache.max-entries:500}") long maxEntries) {
        return new RecipeSearchCache(recipeCatalog, ttl, maxEntries);
    }
}
