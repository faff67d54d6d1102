package com.cheflink.agent.kitchen;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recipe catalog held in memory, seeded with a small starter collection.
 */
@Component
@ConditionalOnProperty(name = "kitchen.storage", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryRecipeCatalog implements RecipeCatalog {

    private final Map<String, Recipe> recipes = new ConcurrentHashMap<>();

    public InMemoryRecipeCatalog() {
        this(starterRecipes());
    }

    public InMemoryRecipeCatalog(List<Recipe> seed) {
        seed.forEach(this::add);
        log.info("Recipe catalog loaded with {} recipe(s)", recipes.size());
    }

    public void add(Recipe recipe) {
        recipes.put(recipe.getId(), recipe);
    }

    @Override
    public Optional<Recipe> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(recipes.get(id));
    }

    @Override
    public List<Recipe> search(RecipeQuery query) {
        String text = query.getText() != null ? query.getText().toLowerCase(Locale.ROOT) : null;
        List<String> proteins = query.getMainProteins().stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();

        return recipes.values().stream()
                .filter(r -> text == null || text.isBlank() || r.getName().toLowerCase(Locale.ROOT).contains(text))
                .filter(r -> proteins.isEmpty() || r.getMainProtein().stream().anyMatch(proteins::contains))
                .filter(r -> query.getMaxCalories() == null || r.getCaloriesPerServing() <= query.getMaxCalories())
                .filter(r -> query.getMinProtein() == null || r.getMacros().proteinG() >= query.getMinProtein())
                .sorted(Comparator.comparing(Recipe::getName))
                .limit(Math.max(0, query.getLimit()))
                .toList();
    }

    static List<Recipe> starterRecipes() {
        return List.of(
                Recipe.builder()
                        .id("r-grilled-chicken").name("Grilled Chicken Breast").author("Test Chef")
                        .book("Quick & Healthy").pageReference("15").servings(1).caloriesPerServing(250)
                        .macros(new Recipe.Macros(35, 8, 2))
                        .ingredients(List.of("1 chicken breast (6 oz)", "1 tsp olive oil", "1/2 tsp salt",
                                "1/4 tsp black pepper", "1 tsp mixed herbs"))
                        .instructions("Season the chicken, grill 6-7 minutes per side until 74°C inside, rest 5 minutes.")
                        .mainProtein(List.of("chicken"))
                        .build(),
                Recipe.builder()
                        .id("r-caesar-salad").name("Caesar Salad").author("Test Chef")
                        .book("Quick & Healthy").pageReference("23").servings(1).caloriesPerServing(220)
                        .macros(new Recipe.Macros(8, 15, 12))
                        .ingredients(List.of("2 cups romaine lettuce", "2 tbsp caesar dressing",
                                "1/4 cup croutons", "2 tbsp parmesan cheese"))
                        .instructions("Chop the lettuce, toss with dressing, top with croutons and parmesan.")
                        .build(),
                Recipe.builder()
                        .id("r-salmon-veg").name("Salmon with Vegetables").author("Test Chef")
                        .book("Quick & Healthy").pageReference("45").servings(1).caloriesPerServing(380)
                        .macros(new Recipe.Macros(32, 22, 8))
                        .ingredients(List.of("6 oz salmon fillet", "1 cup mixed vegetables", "1 tbsp olive oil",
                                "1 lemon wedge", "salt and pepper to taste"))
                        .instructions("Season the salmon, pan-fry 4-5 minutes per side, serve with steamed vegetables.")
                        .mainProtein(List.of("salmon"))
                        .build(),
                Recipe.builder()
                        .id("r-veg-stir-fry").name("Vegetable Stir Fry").author("Test Chef")
                        .book("Quick & Healthy").pageReference("67").servings(1).caloriesPerServing(180)
                        .macros(new Recipe.Macros(6, 8, 22))
                        .ingredients(List.of("2 cups mixed vegetables", "1 tbsp oil", "2 tbsp soy sauce",
                                "1 tsp garlic", "1 tsp ginger"))
                        .instructions("Stir fry the vegetables hardest first for 5-7 minutes, add sauce, cook 2 more minutes.")
                        .build(),
                Recipe.builder()
                        .id("r-yogurt-parfait").name("Greek Yogurt Parfait").author("Test Chef")
                        .book("Quick & Healthy").pageReference("89").servings(1).caloriesPerServing(280)
                        .macros(new Recipe.Macros(18, 6, 38))
                        .ingredients(List.of("1 cup Greek yogurt", "1/2 cup mixed berries", "1/4 cup granola",
                                "1 tbsp honey"))
                        .instructions("Layer yogurt, berries and granola, repeat, drizzle with honey.")
                        .build(),
                Recipe.builder()
                        .id("r-chicken-curry").name("Chicken Tikka Curry").author("Test Chef")
                        .book("Weeknight Classics").pageReference("112").servings(4).caloriesPerServing(450)
                        .macros(new Recipe.Macros(38, 20, 28))
                        .ingredients(List.of("600 g chicken thigh", "200 g yogurt", "400 g tomato passata",
                                "1 onion", "2 tbsp tikka paste"))
                        .instructions("Marinate the chicken in yogurt and paste, brown it, simmer in passata and onion 25 minutes.")
                        .mainProtein(List.of("chicken"))
                        .build()
        );
    }
}
