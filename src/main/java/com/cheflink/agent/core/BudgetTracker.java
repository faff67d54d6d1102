package com.cheflink.agent.core;

import com.cheflink.agent.observability.TerminationReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Iteration, wall-time and spend accounting for one run.
 *
 * {@link #check()} is asked before every model call; counters only move in
 * {@link #recordIteration} with what the call actually cost and took.
 */
@Slf4j
public class BudgetTracker {

    private final int maxIterations;
    private final Duration maxTime;
    private final double costLimit;
    private final Clock clock;
    private final Instant startedAt;

    private int iterationCount;
    private double cumulativeCost;

    public BudgetTracker(int maxIterations, Duration maxTime, double costLimit, Clock clock) {
        this.maxIterations = maxIterations;
        this.maxTime = maxTime;
        this.costLimit = costLimit;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * @return the exhausted limit, or empty if another model call may be issued
     */
    public Optional<TerminationReason> check() {
        if (iterationCount >= maxIterations) {
            log.info("Iteration budget exhausted ({}/{})", iterationCount, maxIterations);
            return Optional.of(TerminationReason.ITERATION_LIMIT);
        }
        Duration elapsed = elapsed();
        if (elapsed.compareTo(maxTime) >= 0) {
            log.info("Time budget exhausted ({}ms >= {}ms)", elapsed.toMillis(), maxTime.toMillis());
            return Optional.of(TerminationReason.TIME_LIMIT);
        }
        if (cumulativeCost >= costLimit) {
            log.info("Cost budget exhausted (${} >= ${})", cumulativeCost, costLimit);
            return Optional.of(TerminationReason.COST_LIMIT);
        }
        return Optional.empty();
    }

    public void recordIteration(double cost, Duration duration) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost cannot be negative");
        }
        iterationCount++;
        cumulativeCost += cost;
        log.debug("Iteration {} recorded: cost=${} duration={}ms total=${}",
                iterationCount, cost, duration.toMillis(), cumulativeCost);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public int iterationCount() {
        return iterationCount;
    }

    public double cumulativeCost() {
        return cumulativeCost;
    }

    public int maxIterations() {
        return maxIterations;
    }
}
