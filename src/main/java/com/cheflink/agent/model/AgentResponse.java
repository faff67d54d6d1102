package com.cheflink.agent.model;

import com.cheflink.agent.observability.TerminationReason;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The single user-visible result of a run. Carries only the visible answer;
 * hidden reasoning stays in the trace.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String finalAnswer;

    @Builder.Default
    private List<ToolCall> toolCallsExecuted = new ArrayList<>();

    private int iterationsUsed;
    private TerminationReason terminationReason;
    private String conversationId;

    public boolean isBudgetExhausted() {
        return terminationReason != null && terminationReason.isBudgetLimit();
    }
}
