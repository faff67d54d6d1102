package com.cheflink.agent.kitchen;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One planned meal. A user has at most one entry per date and meal type.
 */
@Value
@Builder
public class MealPlanEntry {

    String userId;
    LocalDate date;
    MealType mealType;
    String recipeId;

    @Builder.Default
    int servings = 1;
}
