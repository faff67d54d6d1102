package com.cheflink.agent.kitchen;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the recipe collection.
 */
public interface RecipeCatalog {

    Optional<Recipe> findById(String id);

    /**
     * @return matches ordered by name, at most {@code query.limit} of them
     */
    List<Recipe> search(RecipeQuery query);
}
