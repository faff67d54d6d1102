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
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nutrition totals of the meals planned on one day, scaled by servings.
 */
@Component
public class AnalyzeNutritionTool implements AgentTool {

    private static final String ALL = "all";

    private final MealPlanStore mealPlanStore;
    private final RecipeCatalog catalog;
    private final ObjectMapper objectMapper;

    public AnalyzeNutritionTool(MealPlanStore mealPlanStore, RecipeCatalog catalog, ObjectMapper objectMapper) {
        this.mealPlanStore = mealPlanStore;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "analyze_nutrition";
    }

    @Override
    public String getDescription() {
        return """
                Calories, protein, fat and carbohydrates of the meals planned for a date, in total
                and per meal. Optionally restricted to one meal type.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.NUTRITION;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        List<String> mealTypes = new ArrayList<>(MealType.wireNames());
        mealTypes.add(ALL);
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "date", Map.of("type", "string", "description", "Day to analyze, yyyy-MM-dd"),
                        "meal_type", Map.of(
                                "type", "string",
                                "enum", List.copyOf(mealTypes),
                                "description", "Meal to analyze (default all)")
                ),
                "required", List.of("date")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        LocalDate date = ToolArguments.date(arguments, "date");
        String mealTypeArg = Optional.ofNullable(ToolArguments.string(arguments, "meal_type")).orElse(ALL);
        MealType filter = ALL.equals(mealTypeArg) ? null : MealType.fromWire(mealTypeArg);

        double calories = 0;
        double protein = 0;
        double fat = 0;
        double carbs = 0;
        List<Map<String, Object>> breakdown = new ArrayList<>();

        for (MealPlanEntry entry : mealPlanStore.findForUser(context.userId(), date, date)) {
            if (filter != null && entry.getMealType() != filter) {
                continue;
            }
            Optional<Recipe> found = catalog.findById(entry.getRecipeId());
            if (found.isEmpty()) {
                continue;
            }
            Recipe recipe = found.get();
            int servings = entry.getServings();

            Map<String, Object> meal = new LinkedHashMap<>();
            meal.put("meal_type", entry.getMealType().wireName());
            meal.put("recipe_name", recipe.getName());
            meal.put("servings", servings);
            meal.put("calories", recipe.getCaloriesPerServing() * servings);
            meal.put("protein_g", recipe.getMacros().proteinG() * servings);
            meal.put("fat_g", recipe.getMacros().fatG() * servings);
            meal.put("carbohydrates_g", recipe.getMacros().carbohydratesG() * servings);
            breakdown.add(meal);

            calories += recipe.getCaloriesPerServing() * servings;
            protein += recipe.getMacros().proteinG() * servings;
            fat += recipe.getMacros().fatG() * servings;
            carbs += recipe.getMacros().carbohydratesG() * servings;
        }

        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("calories", calories);
        totals.put("protein_g", protein);
        totals.put("fat_g", fat);
        totals.put("carbohydrates_g", carbs);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("date", date.toString());
        result.put("meal_type", mealTypeArg);
        result.put("total_nutrition", totals);
        result.put("meal_breakdown", breakdown);
        return objectMapper.writeValueAsString(result);
    }
}
