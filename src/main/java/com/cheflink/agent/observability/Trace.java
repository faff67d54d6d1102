package com.cheflink.agent.observability;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Complete record of one run, handed to the {@link TraceSink} when the run ends.
 */
@Value
@Builder
public class Trace {

    String conversationId;
    String userId;
    String userInput;
    Instant startedAt;

    List<IterationRecord> iterations;
    List<String> stateTransitions;

    double totalCost;
    long totalDurationMs;
    TerminationReason terminationReason;
    String finalAnswer;

    /** Present for failure terminations */
    String errorMessage;

    public int toolCallCount() {
        return iterations.stream().mapToInt(i -> i.getToolCalls().size()).sum();
    }
}
