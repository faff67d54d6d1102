package com.cheflink.agent.tool;

import java.util.Set;

/**
 * Per-run information handed to every tool invocation.
 *
 * @param allowedCategories categories this run may call; empty means all
 */
public record ToolContext(String conversationId, String userId, Set<ToolCategory> allowedCategories) {

    public ToolContext {
        allowedCategories = allowedCategories == null || allowedCategories.isEmpty()
                ? Set.of()
                : Set.copyOf(allowedCategories);
    }

    public static ToolContext of(String conversationId, String userId) {
        return new ToolContext(conversationId, userId, Set.of());
    }

    public boolean allows(ToolCategory category) {
        return allowedCategories.isEmpty() || allowedCategories.contains(category);
    }
}
