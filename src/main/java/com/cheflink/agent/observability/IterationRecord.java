package com.cheflink.agent.observability;

import com.cheflink.agent.model.ToolCall;
import com.cheflink.agent.model.ToolResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What happened in one model round-trip. Built once the iteration is over.
 */
@Value
@Builder
public class IterationRecord {

    public enum Outcome { TOOL_CALLS, FINAL_MESSAGE, INCONCLUSIVE, MODEL_TIMEOUT, MODEL_ERROR }

    int index;
    Outcome outcome;
    String rawModelOutput;

    /** Text outside the visible answer. Trace only, never shown to the user. */
    String internalReasoning;

    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    @Builder.Default
    List<ToolResult> toolResults = List.of();

    double cost;
    long durationMs;
    int promptTokens;
    int completionTokens;
}
