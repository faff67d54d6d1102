package com.cheflink.agent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples the wire format from the AgentTool implementation.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    ToolCategory category;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .category(tool.getCategory())
                .inputSchema(Map.copyOf(tool.getInputSchema()))
                .build();
    }

    /**
     * Converts to OpenAI's expected tool format.
     * OpenAI expects: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
