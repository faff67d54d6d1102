package com.cheflink.agent.core;

import com.cheflink.agent.observability.TerminationReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetTrackerTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void freshTracker_allowsCall() {
        BudgetTracker budget = new BudgetTracker(3, Duration.ofSeconds(60), 0.5, clock);

        assertThat(budget.check()).isEmpty();
        assertThat(budget.iterationCount()).isZero();
    }

    @Test
    void iterationLimit_reachedAfterMaxIterations() {
        BudgetTracker budget = new BudgetTracker(2, Duration.ofSeconds(60), 0.5, clock);
        budget.recordIteration(0.01, Duration.ofMillis(10));
        assertThat(budget.check()).isEmpty();

        budget.recordIteration(0.01, Duration.ofMillis(10));

        assertThat(budget.check()).contains(TerminationReason.ITERATION_LIMIT);
    }

    @Test
    void timeLimit_usesInjectedClock() {
        BudgetTracker budget = new BudgetTracker(10, Duration.ofSeconds(30), 0.5, clock);
        clock.advance(Duration.ofSeconds(29));
        assertThat(budget.check()).isEmpty();

        clock.advance(Duration.ofSeconds(1));

        assertThat(budget.check()).contains(TerminationReason.TIME_LIMIT);
        assertThat(budget.elapsed()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void costLimit_isInclusive() {
        BudgetTracker budget = new BudgetTracker(10, Duration.ofSeconds(60), 0.10, clock);
        budget.recordIteration(0.06, Duration.ZERO);
        assertThat(budget.check()).isEmpty();

        budget.recordIteration(0.04, Duration.ZERO);

        assertThat(budget.check()).contains(TerminationReason.COST_LIMIT);
        assertThat(budget.cumulativeCost()).isCloseTo(0.10, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void iterationLimit_checkedBeforeTimeAndCost() {
        BudgetTracker budget = new BudgetTracker(1, Duration.ofSeconds(1), 0.01, clock);
        budget.recordIteration(0.5, Duration.ZERO);
        clock.advance(Duration.ofSeconds(5));

        assertThat(budget.check()).contains(TerminationReason.ITERATION_LIMIT);
    }

    @Test
    void zeroCostIteration_stillCounts() {
        BudgetTracker budget = new BudgetTracker(1, Duration.ofSeconds(60), 0.5, clock);

        budget.recordIteration(0.0, Duration.ofSeconds(30));

        assertThat(budget.iterationCount()).isEqualTo(1);
        assertThat(budget.check()).contains(TerminationReason.ITERATION_LIMIT);
    }

    @Test
    void negativeCost_isRejected() {
        BudgetTracker budget = new BudgetTracker(3, Duration.ofSeconds(60), 0.5, clock);

        assertThatThrownBy(() -> budget.recordIteration(-0.01, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(budget.iterationCount()).isZero();
    }
}
