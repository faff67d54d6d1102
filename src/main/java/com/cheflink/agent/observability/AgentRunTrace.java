package com.cheflink.agent.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Stored form of a {@link Trace}.
 *
 * Iterations are embedded as sub-documents, so a single read gives the whole
 * run: raw outputs, tool calls with their results, per-iteration cost.
 * E.g: db.agent_run_traces.find({ "iterations.toolCalls.toolName": "search_recipes" })
 */
@Document(collection = "agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    @Id
    private String id;

    @Indexed
    private String conversationId;

    @Indexed
    private String userId;

    private String userInput;
    private String finalAnswer;

    @Indexed
    private TerminationReason terminationReason;

    private int iterationsUsed;
    private int toolCallCount;
    private long totalDurationMs;
    private double totalCost;

    private int promptTokens;
    private int completionTokens;

    private List<IterationRecord> iterations;
    private List<String> stateTransitions;

    /** Present for parse_failure / fatal_error */
    private String errorMessage;

    private Instant startedAt;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
