package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.MealPlanEntry;
import com.cheflink.agent.kitchen.MealPlanStore;
import com.cheflink.agent.kitchen.Recipe;
import com.cheflink.agent.kitchen.RecipeCatalog;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Planned meals of the current user, grouped by date.
 * Without an explicit range it covers today and the following {@code days}.
 */
@Component
public class GetMealPlansTool implements AgentTool {

    private final MealPlanStore mealPlanStore;
    private final RecipeCatalog catalog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GetMealPlansTool(MealPlanStore mealPlanStore, RecipeCatalog catalog,
                            ObjectMapper objectMapper, Clock clock) {
        this.mealPlanStore = mealPlanStore;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "get_meal_plans";
    }

    @Override
    public String getDescription() {
        return """
                List the user's planned meals. Give start_date and end_date (yyyy-MM-dd) for a
                specific range, or days to look ahead from today (default 7).
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
                        "start_date", Map.of("type", "string", "description", "First day, yyyy-MM-dd"),
                        "end_date", Map.of("type", "string", "description", "Last day, yyyy-MM-dd"),
                        "days", Map.of("type", "integer", "description", "Days ahead from today when no range is given")
                ),
                "required", List.of()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        LocalDate start = ToolArguments.date(arguments, "start_date");
        LocalDate end = ToolArguments.date(arguments, "end_date");
        if (start == null || end == null) {
            start = LocalDate.now(clock);
            end = start.plusDays(ToolArguments.integer(arguments, "days", 7));
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end_date " + end + " is before start_date " + start);
        }

        Map<String, List<Map<String, Object>>> byDate = new LinkedHashMap<>();
        for (MealPlanEntry entry : mealPlanStore.findForUser(context.userId(), start, end)) {
            Recipe recipe = catalog.findById(entry.getRecipeId()).orElse(null);

            Map<String, Object> meal = new LinkedHashMap<>();
            meal.put("meal_type", entry.getMealType().wireName());
            meal.put("recipe_id", entry.getRecipeId());
            meal.put("recipe_name", recipe != null ? recipe.getName() : "Unknown");
            meal.put("servings", entry.getServings());
            meal.put("calories", recipe != null ? recipe.getCaloriesPerServing() * entry.getServings() : 0);
            byDate.computeIfAbsent(entry.getDate().toString(), d -> new ArrayList<>()).add(meal);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("start_date", start.toString());
        result.put("end_date", end.toString());
        result.put("meal_plans", byDate);
        return objectMapper.writeValueAsString(result);
    }
}
