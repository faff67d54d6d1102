package com.cheflink.agent.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is a JSON Schema object sent to the
 * model so it knows how to invoke the tool, and it is also what the executor
 * validates arguments against before {@link #execute} is ever called.
 *
 * Implementations may throw; the executor turns any exception into a failed
 * tool result and the loop carries on.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    ToolCategory getCategory();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters:
     * type=object, properties, required, optional enum per property.
     */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool with already-validated arguments and return the
     * observation fed back to the model.
     */
    String execute(Map<String, Object> arguments, ToolContext context) throws Exception;
}
