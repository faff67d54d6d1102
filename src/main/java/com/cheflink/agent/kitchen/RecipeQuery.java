package com.cheflink.agent.kitchen;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Recipe search filters. All optional; equal queries share a cache entry.
 */
@Value
@Builder
public class RecipeQuery {

    /** Case-insensitive substring of the recipe name */
    String text;

    /** Matches if the recipe has any of these proteins */
    @Builder.Default
    List<String> mainProteins = List.of();

    Integer maxCalories;
    Double minProtein;

    @Builder.Default
    int limit = 10;
}
