package com.cheflink.agent.model;

import com.cheflink.agent.tool.ToolErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Uniform outcome of a single tool call. Exactly one per {@link ToolCall},
 * matched through {@link #callId}.
 */
@Value
@Builder
public class ToolResult {

    String callId;
    String toolName;
    boolean success;

    /** Present when success = true (possibly truncated) */
    String payload;

    /** Present when success = false */
    ToolErrorKind errorKind;
    String errorMessage;

    boolean truncated;
    int originalLength;
    long durationMs;

    public static ToolResult failure(ToolCall call, ToolErrorKind kind, String message, long durationMs) {
        return ToolResult.builder()
                .callId(call.getId())
                .toolName(call.getToolName())
                .success(false)
                .errorKind(kind)
                .errorMessage(message)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Text fed back to the model as the tool message content.
     * Failures keep the "ERROR" prefix so the model can tell them apart and recover.
     */
    public String toObservation() {
        if (success) {
            return payload;
        }
        return "ERROR [" + errorKind.wireName() + "]: " + errorMessage;
    }
}
