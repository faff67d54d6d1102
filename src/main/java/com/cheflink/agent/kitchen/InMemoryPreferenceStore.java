package com.cheflink.agent.kitchen;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "kitchen.storage", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryPreferenceStore implements PreferenceStore {

    private final Map<String, Map<String, Object>> preferences = new ConcurrentHashMap<>();

    @Override
    public Map<String, Object> get(String userId) {
        Map<String, Object> stored = preferences.get(userId);
        return stored == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stored));
    }

    @Override
    public Map<String, Object> merge(String userId, Map<String, Object> updates) {
        Map<String, Object> merged = preferences.compute(userId, (id, current) -> {
            Map<String, Object> next = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
            next.putAll(updates);
            return next;
        });
        return Collections.unmodifiableMap(new LinkedHashMap<>(merged));
    }
}
