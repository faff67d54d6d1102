package com.cheflink.agent.kitchen;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "kitchen.storage", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryMealPlanStore implements MealPlanStore {

    private record Slot(String userId, LocalDate date, MealType mealType) {}

    private final Map<Slot, MealPlanEntry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean upsert(MealPlanEntry entry) {
        MealPlanEntry previous = entries.put(new Slot(entry.getUserId(), entry.getDate(), entry.getMealType()), entry);
        log.debug("Meal plan {} [userId={}, date={}, mealType={}, recipeId={}]",
                previous != null ? "replaced" : "created", entry.getUserId(), entry.getDate(),
                entry.getMealType().wireName(), entry.getRecipeId());
        return previous != null;
    }

    @Override
    public List<MealPlanEntry> findForUser(String userId, LocalDate from, LocalDate to) {
        return entries.values().stream()
                .filter(e -> e.getUserId().equals(userId))
                .filter(e -> !e.getDate().isBefore(from) && !e.getDate().isAfter(to))
                .sorted(Comparator.comparing(MealPlanEntry::getDate).thenComparing(MealPlanEntry::getMealType))
                .toList();
    }
}
