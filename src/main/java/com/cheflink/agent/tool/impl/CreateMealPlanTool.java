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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plans several meals for one day in a single call.
 *
 * Every entry is checked before anything is written. Recipe ids the catalog
 * does not know are skipped and reported back instead of failing the call.
 */
@Component
@Slf4j
public class CreateMealPlanTool implements AgentTool {

    private final MealPlanStore mealPlanStore;
    private final RecipeCatalog catalog;
    private final ObjectMapper objectMapper;

    public CreateMealPlanTool(MealPlanStore mealPlanStore, RecipeCatalog catalog, ObjectMapper objectMapper) {
        this.mealPlanStore = mealPlanStore;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "create_meal_plan";
    }

    @Override
    public String getDescription() {
        return """
                Create a meal plan for one day. Pass the date and a list of meals, each with
                recipe_id, meal_type and optional servings. Use recipe ids from search_recipes.
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
                        "date", Map.of("type", "string", "description", "Day of the plan, yyyy-MM-dd"),
                        "meals", Map.of(
                                "type", "array",
                                "description", "Meals to plan",
                                "items", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "recipe_id", Map.of("type", "string"),
                                                "meal_type", Map.of("type", "string", "enum", MealType.wireNames()),
                                                "servings", Map.of("type", "integer")),
                                        "required", List.of("recipe_id", "meal_type")))
                ),
                "required", List.of("date", "meals")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        LocalDate date = ToolArguments.date(arguments, "date");
        List<MealPlanEntry> requested = readMeals(arguments.get("meals"), date, context.userId());

        List<Map<String, Object>> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (MealPlanEntry entry : requested) {
            Optional<Recipe> recipe = catalog.findById(entry.getRecipeId());
            if (recipe.isEmpty()) {
                skipped.add(entry.getRecipeId());
                continue;
            }
            mealPlanStore.upsert(entry);

            Map<String, Object> meal = new LinkedHashMap<>();
            meal.put("meal_type", entry.getMealType().wireName());
            meal.put("recipe_name", recipe.get().getName());
            meal.put("servings", entry.getServings());
            created.add(meal);
        }

        log.info("Meal plan created [userId={}, date={}, meals={}, skipped={}]",
                context.userId(), date, created.size(), skipped);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("date", date.toString());
        result.put("meals_created", created);
        if (!skipped.isEmpty()) {
            result.put("skipped_recipe_ids", skipped);
        }
        return objectMapper.writeValueAsString(result);
    }

    private static List<MealPlanEntry> readMeals(Object raw, LocalDate date, String userId) {
        if (!(raw instanceof List<?> meals) || meals.isEmpty()) {
            throw new IllegalArgumentException("'meals' must list at least one meal");
        }
        List<MealPlanEntry> entries = new ArrayList<>(meals.size());
        for (int i = 0; i < meals.size(); i++) {
            if (!(meals.get(i) instanceof Map<?, ?> meal)) {
                throw new IllegalArgumentException("meals[" + i + "] must be an object");
            }
            Object recipeId = meal.get("recipe_id");
            Object mealType = meal.get("meal_type");
            if (!(recipeId instanceof String id) || id.isBlank()) {
                throw new IllegalArgumentException("meals[" + i + "] is missing recipe_id");
            }
            if (!(mealType instanceof String type) || !MealType.wireNames().contains(type.trim().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("meals[" + i + "].meal_type must be one of " + MealType.wireNames());
            }
            Object rawServings = meal.get("servings");
            int servings = rawServings instanceof Number n ? n.intValue() : 1;
            if (servings < 1) {
                throw new IllegalArgumentException("meals[" + i + "].servings must be at least 1");
            }
            entries.add(MealPlanEntry.builder()
                    .userId(userId)
                    .date(date)
                    .mealType(MealType.fromWire(type))
                    .recipeId(id.trim())
                    .servings(servings)
                    .build());
        }
        return entries;
    }
}
