package com.cheflink.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw output of one model call.
 *
 * The text may embed a final-message marker or tool-call directives; providers
 * with native function calling also fill {@link #toolCalls}. Interpretation is
 * left to the ResponseParser.
 */
@Data
@Builder
public class ModelCompletion {

    private String rawText;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    /** Cost as reported by the provider, when it reports one. */
    private Double reportedCost;

    private String model;

    public boolean hasStructuredToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
