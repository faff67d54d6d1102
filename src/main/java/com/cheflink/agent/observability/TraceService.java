package com.cheflink.agent.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Persistence is @Async: it never delays the user's answer.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService implements TraceSink {

    static final int MAX_TEXT = 8000;

    private final AgentRunTraceRepository traceRepository;
    private final Clock clock;

    @Override
    @Async("traceTaskExecutor")
    public void accept(Trace trace) {
        try {
            AgentRunTrace document = toDocument(trace);
            traceRepository.save(document);

            log.info("Trace persisted [conversationId={}, reason={}, iterations={}, duration={}ms, cost=${}]",
                    trace.getConversationId(), trace.getTerminationReason().wireName(),
                    document.getIterationsUsed(), trace.getTotalDurationMs(),
                    String.format("%.4f", trace.getTotalCost()));

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace for conversationId={}", trace.getConversationId(), e);
        }
    }

    AgentRunTrace toDocument(Trace trace) {
        List<IterationRecord> iterations = trace.getIterations();
        return AgentRunTrace.builder()
                .conversationId(trace.getConversationId())
                .userId(trace.getUserId())
                .userInput(truncate(trace.getUserInput(), 4000))
                .finalAnswer(truncate(trace.getFinalAnswer(), MAX_TEXT))
                .terminationReason(trace.getTerminationReason())
                .iterationsUsed(iterations.size())
                .toolCallCount(trace.toolCallCount())
                .totalDurationMs(trace.getTotalDurationMs())
                .totalCost(trace.getTotalCost())
                .promptTokens(iterations.stream().mapToInt(IterationRecord::getPromptTokens).sum())
                .completionTokens(iterations.stream().mapToInt(IterationRecord::getCompletionTokens).sum())
                .iterations(iterations)
                .stateTransitions(trace.getStateTransitions())
                .errorMessage(trace.getErrorMessage())
                .startedAt(trace.getStartedAt())
                .build();
    }

    public List<AgentRunTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<AgentRunTrace> getTracesForConversation(String conversationId) {
        return traceRepository.findByConversationIdOrderByCreatedAtDesc(conversationId);
    }

    /**
     * Summary analytics for a user: avg duration, spend in the last 24h, termination breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = clock.instant().minus(24, ChronoUnit.HOURS);

        Double avgDuration = traceRepository.avgDurationForUser(userId);
        Double costLast24h = traceRepository.totalCostSince(userId, since24h);

        Map<String, Long> breakdown = traceRepository.terminationBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        AgentRunTraceRepository.ReasonCount::id,
                        AgentRunTraceRepository.ReasonCount::count,
                        Long::sum));

        return Map.of(
                "userId", userId,
                "avgDurationMs", avgDuration != null ? Math.round(avgDuration) : 0,
                "totalCostLast24h", costLast24h != null ? costLast24h : 0.0,
                "terminationBreakdown", breakdown
        );
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
