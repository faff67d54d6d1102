package com.cheflink.agent.tool;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Configurable tool for registry and executor tests. */
class StubTool implements AgentTool {

    private final String name;
    private final ToolCategory category;
    private final Map<String, Object> schema;
    private final Function<Map<String, Object>, String> behaviour;

    StubTool(String name, ToolCategory category, Function<Map<String, Object>, String> behaviour) {
        this(name, category, Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of("type", "string"),
                        "limit", Map.of("type", "integer")),
                "required", List.of("query")), behaviour);
    }

    StubTool(String name, ToolCategory category, Map<String, Object> schema,
             Function<Map<String, Object>, String> behaviour) {
        this.name = name;
        this.category = category;
        this.schema = schema;
        this.behaviour = behaviour;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "stub " + name;
    }

    @Override
    public ToolCategory getCategory() {
        return category;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return schema;
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        return behaviour.apply(arguments);
    }
}
