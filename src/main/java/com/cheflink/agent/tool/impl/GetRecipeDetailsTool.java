package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.Recipe;
import com.cheflink.agent.kitchen.RecipeCatalog;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class GetRecipeDetailsTool implements AgentTool {

    private final RecipeCatalog catalog;
    private final ObjectMapper objectMapper;

    public GetRecipeDetailsTool(RecipeCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "get_recipe_details";
    }

    @Override
    public String getDescription() {
        return "Full recipe by id: ingredients, instructions, servings, calories and macros per serving.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.RECIPE_SEARCH;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "recipe_id", Map.of(
                                "type", "string",
                                "description", "Recipe id as returned by search_recipes")
                ),
                "required", List.of("recipe_id")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        String recipeId = ToolArguments.string(arguments, "recipe_id");
        Recipe recipe = catalog.findById(recipeId)
                .orElseThrow(() -> new IllegalArgumentException("Recipe " + recipeId + " not found"));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("id", recipe.getId());
        details.put("name", recipe.getName());
        details.put("author", recipe.getAuthor());
        details.put("book", recipe.getBook());
        details.put("page", recipe.getPageReference());
        details.put("servings", recipe.getServings());
        details.put("calories", recipe.getCaloriesPerServing());
        details.put("macro_nutrients", Map.of(
                "protein_g", recipe.getMacros().proteinG(),
                "fat_g", recipe.getMacros().fatG(),
                "carbohydrates_g", recipe.getMacros().carbohydratesG()));
        details.put("ingredients", recipe.getIngredients());
        details.put("instructions", recipe.getInstructions());
        details.put("main_protein", recipe.getMainProtein());
        return objectMapper.writeValueAsString(details);
    }
}
