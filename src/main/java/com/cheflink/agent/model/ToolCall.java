package com.cheflink.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Unique within the iteration that produced it; echoed back on the tool result */
    private String id;

    private String toolName;

    /** Raw arguments as the model produced them, not yet validated */
    private Map<String, Object> arguments;
}
