package com.cheflink.agent.observability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collector for one run.
 *
 * Kept apart from the conversation state so observability never feeds back
 * into control decisions: the loop writes here and never reads.
 */
public class TraceRecorder {

    private final String conversationId;
    private final String userId;
    private final String userInput;
    private final Clock clock;
    private final Instant startedAt;

    private final List<IterationRecord> iterations = new ArrayList<>();
    private final List<String> transitions = new ArrayList<>();
    private double totalCost;
    private Trace finished;

    public TraceRecorder(String conversationId, String userId, String userInput, Clock clock) {
        this.conversationId = conversationId;
        this.userId = userId;
        this.userInput = userInput;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordTransition(Enum<?> from, Enum<?> to) {
        ensureOpen();
        transitions.add(from.name() + "->" + to.name());
    }

    public void recordIteration(IterationRecord iteration) {
        ensureOpen();
        if (!iterations.isEmpty() && iteration.getIndex() <= iterations.get(iterations.size() - 1).getIndex()) {
            throw new IllegalArgumentException("Iteration indices must increase, got " + iteration.getIndex());
        }
        iterations.add(iteration);
        totalCost += iteration.getCost();
    }

    /**
     * Seals the recorder. Further writes fail.
     */
    public Trace finish(TerminationReason reason, String finalAnswer, String errorMessage) {
        ensureOpen();
        Objects.requireNonNull(reason, "termination reason");
        finished = Trace.builder()
                .conversationId(conversationId)
                .userId(userId)
                .userInput(userInput)
                .startedAt(startedAt)
                .iterations(Collections.unmodifiableList(new ArrayList<>(iterations)))
                .stateTransitions(List.copyOf(transitions))
                .totalCost(totalCost)
                .totalDurationMs(Duration.between(startedAt, clock.instant()).toMillis())
                .terminationReason(reason)
                .finalAnswer(finalAnswer)
                .errorMessage(errorMessage)
                .build();
        return finished;
    }

    public boolean isFinished() {
        return finished != null;
    }

    public int iterationCount() {
        return iterations.size();
    }

    private void ensureOpen() {
        if (finished != null) {
            throw new IllegalStateException("Trace for " + conversationId + " already finished");
        }
    }
}
