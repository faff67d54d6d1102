package com.cheflink.agent.kitchen;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Recipe {

    String id;
    String name;
    String author;
    String book;
    String pageReference;
    int servings;
    int caloriesPerServing;

    /** Per serving */
    @Builder.Default
    Macros macros = Macros.ZERO;

    @Builder.Default
    List<String> ingredients = List.of();

    String instructions;

    /** Lower-case protein names, e.g. "chicken"; empty for vegetarian dishes */
    @Builder.Default
    List<String> mainProtein = List.of();

    public record Macros(double proteinG, double fatG, double carbohydratesG) {
        public static final Macros ZERO = new Macros(0, 0, 0);
    }
}
