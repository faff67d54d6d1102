package com.cheflink.agent.tool.impl;

import com.cheflink.agent.kitchen.PreferenceStore;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class GetUserPreferencesTool implements AgentTool {

    private final PreferenceStore preferenceStore;
    private final ObjectMapper objectMapper;

    public GetUserPreferencesTool(PreferenceStore preferenceStore, ObjectMapper objectMapper) {
        this.preferenceStore = preferenceStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "get_user_preferences";
    }

    @Override
    public String getDescription() {
        return "The user's saved dietary preferences (diet, allergies, dislikes, calorie goals). "
                + "Check these before suggesting recipes.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.USER_PREFERENCES;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "required", List.of()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "user_id", context.userId(),
                "dietary_preferences", preferenceStore.get(context.userId())));
    }
}
