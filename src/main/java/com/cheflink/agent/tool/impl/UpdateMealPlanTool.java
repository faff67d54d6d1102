package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.MealPlanEntry;
import com.cheflink.agent.kitchen.MealPlanStore;
import com.cheflink.agent.kitchen.MealType;
import com.cheflink.agent.kitchen.Recipe;
import com.cheflink.agent.kitchen.RecipeCatalog;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts a recipe in one meal slot, replacing whatever was planned there.
 */
@Component
@Slf4j
public class UpdateMealPlanTool implements AgentTool {

    private final MealPlanStore mealPlanStore;
    private final RecipeCatalog catalog;
    private final ObjectMapper objectMapper;

    public UpdateMealPlanTool(MealPlanStore mealPlanStore, RecipeCatalog catalog, ObjectMapper objectMapper) {
        this.mealPlanStore = mealPlanStore;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "update_meal_plan";
    }

    @Override
    public String getDescription() {
        return """
                Plan a recipe for a meal on a date. Creates the meal if the slot is empty,
                otherwise replaces it. Use a recipe id from search_recipes.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MEAL_PLANNING;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "date", Map.of("type", "string", "description", "Day of the meal, yyyy-MM-dd"),
                        "meal_type", Map.of(
                                "type", "string",
                                "enum", MealType.wireNames(),
                                "description", "Which meal of the day"),
                        "recipe_id", Map.of("type", "string", "description", "Recipe to plan"),
                        "servings", Map.of("type", "integer", "description", "Number of servings (default 1)")
                ),
                "required", List.of("date", "meal_type", "recipe_id")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        LocalDate date = ToolArguments.date(arguments, "date");
        MealType mealType = MealType.fromWire(ToolArguments.string(arguments, "meal_type"));
        String recipeId = ToolArguments.string(arguments, "recipe_id");
        int servings = ToolArguments.integer(arguments, "servings", 1);
        if (servings < 1) {
            throw new IllegalArgumentException("servings must be at least 1");
        }

        Recipe recipe = catalog.findById(recipeId)
                .orElseThrow(() -> new IllegalArgumentException("Recipe " + recipeId + " not found"));

        boolean replaced = mealPlanStore.upsert(MealPlanEntry.builder()
                .userId(context.userId())
                .date(date)
                .mealType(mealType)
                .recipeId(recipeId)
                .servings(servings)
                .build());

        log.info("Meal plan {} [userId={}, date={}, mealType={}, recipe={}]",
                replaced ? "updated" : "created", context.userId(), date, mealType.wireName(), recipe.getName());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("date", date.toString());
        result.put("meal_type", mealType.wireName());
        result.put("recipe_name", recipe.getName());
        result.put("servings", servings);
        result.put("updated", replaced);
        return objectMapper.writeValueAsString(result);
    }
}
