package com.cheflink.agent.core;

import com.cheflink.agent.model.ToolCall;

import java.util.List;

/**
 * Interpretation of one model output. Exactly one of the three kinds.
 *
 * {@code internalReasoning} is whatever the model wrote outside the visible
 * answer. It goes to the trace only; {@code finalMessage} is the only field
 * allowed to reach the user.
 */
public record ParsedResponse(Kind kind,
                             List<ToolCall> toolCalls,
                             String finalMessage,
                             String internalReasoning) {

    public enum Kind { TOOL_CALLS, FINAL_MESSAGE, INCONCLUSIVE }

    public ParsedResponse {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static ParsedResponse toolCalls(List<ToolCall> calls, String reasoning) {
        return new ParsedResponse(Kind.TOOL_CALLS, calls, null, reasoning);
    }

    public static ParsedResponse finalMessage(String message, String reasoning) {
        return new ParsedResponse(Kind.FINAL_MESSAGE, List.of(), message, reasoning);
    }

    public static ParsedResponse inconclusive(String reasoning) {
        return new ParsedResponse(Kind.INCONCLUSIVE, List.of(), null, reasoning);
    }

    public boolean isFinal() {
        return kind == Kind.FINAL_MESSAGE;
    }
}
