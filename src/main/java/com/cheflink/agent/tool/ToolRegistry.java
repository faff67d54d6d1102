package com.cheflink.agent.tool;

import com.cheflink.agent.exception.UnknownToolException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Central, read-only catalog of every AgentTool.
 *
 * Built once at startup through {@link Builder}; duplicate names or a schema the
 * executor cannot validate against fail construction. After {@link Builder#build()}
 * nothing can be added or removed, so concurrent runs read it without locking.
 *
 * Export order is registration order.
 */
@Slf4j
public final class ToolRegistry {

    private final Map<String, AgentTool> tools;
    private final List<ToolDefinition> definitions;

    private ToolRegistry(Map<String, AgentTool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        this.definitions = tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolRegistry of(List<? extends AgentTool> toolBeans) {
        Builder builder = builder();
        toolBeans.forEach(builder::register);
        return builder.build();
    }

    /**
     * @throws UnknownToolException when no tool has this name
     */
    public AgentTool get(String name) {
        AgentTool tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    public Optional<AgentTool> find(String name) {
        return name != null ? Optional.ofNullable(tools.get(name)) : Optional.empty();
    }

    public List<ToolDefinition> exportSchema() {
        return definitions;
    }

    /**
     * Capability list restricted to the given categories; empty means all.
     */
    public List<ToolDefinition> exportSchema(Set<ToolCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return definitions;
        }
        return definitions.stream()
                .filter(d -> categories.contains(d.getCategory()))
                .toList();
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }

    public static final class Builder {

        private final Map<String, AgentTool> tools = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * @throws IllegalStateException on a duplicate name, a bad schema, or after build()
         */
        public Builder register(AgentTool tool) {
            if (built) {
                throw new IllegalStateException("Registry already built; tools can only be registered at startup");
            }
            String name = tool.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Tool " + tool.getClass().getSimpleName() + " has no name");
            }
            if (tool.getCategory() == null) {
                throw new IllegalStateException("Tool [" + name + "] has no category");
            }
            if (tools.containsKey(name)) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
            ToolSchemaValidator.checkSchema(name, tool.getInputSchema());
            tools.put(name, tool);
            log.info("Registered tool: [{}] ({})", name, tool.getCategory());
            return this;
        }

        public ToolRegistry build() {
            built = true;
            ToolRegistry registry = new ToolRegistry(tools);
            log.info("Total tools registered: {}", registry.toolCount());
            return registry;
        }
    }
}
