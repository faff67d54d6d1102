package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.PreferenceStore;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Merges new preference keys into what is already saved.
 */
@Component
@Slf4j
public class UpdateDietaryPreferencesTool implements AgentTool {

    private final PreferenceStore preferenceStore;
    private final ObjectMapper objectMapper;

    public UpdateDietaryPreferencesTool(PreferenceStore preferenceStore, ObjectMapper objectMapper) {
        this.preferenceStore = preferenceStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "update_dietary_preferences";
    }

    @Override
    public String getDescription() {
        return """
                Save dietary preferences the user tells you about, e.g.
                {"diet": "vegetarian", "allergies": ["peanuts"], "daily_calories": 2000}.
                Keys given here overwrite saved ones; other saved keys are kept.
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.USER_PREFERENCES;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "preferences", Map.of(
                                "type", "object",
                                "description", "Preference keys and values to save")
                ),
                "required", List.of("preferences")
        );
    }

    @Override
    @SuppressWarnings("unchecked")
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        Map<String, Object> updates = (Map<String, Object>) arguments.get("preferences");
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("preferences must contain at least one key");
        }
        Map<String, Object> merged = preferenceStore.merge(context.userId(), updates);
        log.info("Dietary preferences updated [userId={}, keys={}]", context.userId(), updates.keySet());
        return objectMapper.writeValueAsString(Map.of(
                "updated", true,
                "preferences", merged));
    }
}
