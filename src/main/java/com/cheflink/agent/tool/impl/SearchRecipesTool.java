package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.Recipe;
import com.cheflink.agent.kitchen.RecipeQuery;
import com.cheflink.agent.kitchen.RecipeSearchCache;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds recipes by name, protein, calorie ceiling and protein floor.
 * Results are served through {@link RecipeSearchCache}.
 */
@Component
@Slf4j
public class SearchRecipesTool implements AgentTool {

    static final int MAX_LIMIT = 50;

    private final RecipeSearchCache searchCache;
    private final ObjectMapper objectMapper;

    public SearchRecipesTool(RecipeSearchCache searchCache, ObjectMapper objectMapper) {
        this.searchCache = searchCache;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "search_recipes";
    }

    @Override
    public String getDescription() {
        return """
                Search the recipe collection. Use this before planning a meal or when the user
                asks for ideas. All filters are optional and can be combined. Returns recipe ids
                to use with get_recipe_details, create_meal_plan and update_meal_plan.
                """;
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
                        "query", Map.of(
                                "type", "string",
                                "description", "Words from the recipe name, e.g. 'curry'"),
                        "main_protein", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Proteins to match, e.g. [\"chicken\", \"salmon\"]"),
                        "max_calories", Map.of(
                                "type", "integer",
                                "description", "Maximum calories per serving"),
                        "min_protein", Map.of(
                                "type", "number",
                                "description", "Minimum grams of protein per serving"),
                        "limit", Map.of(
                                "type", "integer",
                                "description", "Maximum results (default 10, max " + MAX_LIMIT + ")")
                ),
                "required", List.of()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        RecipeQuery query = RecipeQuery.builder()
                .text(ToolArguments.string(arguments, "query"))
                .mainProteins(ToolArguments.strings(arguments, "main_protein"))
                .maxCalories(ToolArguments.integer(arguments, "max_calories", null))
                .minProtein(ToolArguments.number(arguments, "min_protein"))
                .limit(Math.min(MAX_LIMIT, Math.max(1, ToolArguments.integer(arguments, "limit", 10))))
                .build();

        List<Recipe> recipes = searchCache.search(query);
        log.info("Recipe search returned {} result(s) [conversationId={}]", recipes.size(), context.conversationId());

        List<Map<String, Object>> results = recipes.stream().map(this::summary).toList();
        return objectMapper.writeValueAsString(Map.of(
                "count", results.size(),
                "recipes", results));
    }

    private Map<String, Object> summary(Recipe recipe) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", recipe.getId());
        m.put("name", recipe.getName());
        m.put("author", recipe.getAuthor());
        m.put("calories", recipe.getCaloriesPerServing());
        m.put("protein", recipe.getMacros().proteinG());
        m.put("main_protein", recipe.getMainProtein());
        return m;
    }
}
