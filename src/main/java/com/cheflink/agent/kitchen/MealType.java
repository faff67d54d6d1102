package com.cheflink.agent.kitchen;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum MealType {

    BREAKFAST, LUNCH, DINNER, SNACK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MealType fromWire(String value) {
        return MealType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(MealType::wireName).toList();
    }
}
