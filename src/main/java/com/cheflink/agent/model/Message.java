package com.cheflink.agent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a conversation. Immutable once built.
 *
 * The token count is computed by the caller with the same estimator for every
 * message so that the running sum kept by the conversation stays consistent.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public enum Role {
        system, user, assistant, assistant_internal, tool
    }

    Role role;
    String content;

    /** Null means "not yet counted"; such a message cannot be appended. */
    Integer tokenCount;

    /** Set by whoever appends the message, from its clock */
    Instant timestamp;

    /** Present when role = tool: links back to the assistant's tool call id */
    String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back on later requests so the model can correlate tool results.
     */
    List<ToolCall> toolCalls;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
