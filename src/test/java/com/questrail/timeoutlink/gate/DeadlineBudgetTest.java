package com.questrail.timeoutlink.gate;

import com.questrail.timeoutlink.api.RemainingTimeOracle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineBudgetTest {

    private static final TimeoutLinkConfig BUFFER_10MS = TimeoutLinkConfig.withSafetyBuffer(Duration.ofMillis(10));

    @Test
    void hostedBudgetSubtractsSafetyBuffer() {
        DeadlineBudget budget = DeadlineBudget.compute(oracle(Duration.ofMillis(50)), BUFFER_10MS);

        assertInstanceOf(DeadlineBudget.Hosted.class, budget);
        assertEquals(Duration.ofMillis(40), budget.effective());
        assertEquals(Optional.of(Duration.ofMillis(50)), budget.hostRemaining());
        assertFalse(budget.isExhausted());
    }

    @Test
    void remainingBelowBufferIsExhausted() {
        DeadlineBudget budget = DeadlineBudget.compute(
            oracle(Duration.ofMillis(100)), TimeoutLinkConfig.withSafetyBuffer(Duration.ofMillis(200)));

        assertEquals(Duration.ZERO, budget.effective());
        assertTrue(budget.isExhausted());
    }

    @Test
    void remainingEqualToBufferIsExhausted() {
        DeadlineBudget budget = DeadlineBudget.hosted(Duration.ofMillis(10), Duration.ofMillis(10));

        assertTrue(budget.isExhausted());
    }

    @Test
    void negativeRemainingIsExhausted() {
        DeadlineBudget budget = DeadlineBudget.hosted(Duration.ofMillis(-5), Duration.ZERO);

        assertEquals(Duration.ZERO, budget.effective());
        assertTrue(budget.isExhausted());
        assertEquals(Optional.of(Duration.ofMillis(-5)), budget.hostRemaining());
    }

    @Test
    void zeroBufferPassesRemainingThrough() {
        DeadlineBudget budget = DeadlineBudget.hosted(Duration.ofSeconds(3), Duration.ZERO);

        assertEquals(Duration.ofSeconds(3), budget.effective());
    }

    @Test
    void absentOracleIsUnhosted() {
        DeadlineBudget budget = DeadlineBudget.compute(Optional.empty(), BUFFER_10MS);

        assertInstanceOf(DeadlineBudget.Unhosted.class, budget);
        assertEquals(TimeoutLinkConfig.DEFAULT_UNHOSTED_BUDGET, budget.effective());
        assertTrue(budget.hostRemaining().isEmpty());
        assertFalse(budget.isExhausted());
    }

    @Test
    void oracleIsQueriedOnce() {
        int[] calls = {0};
        RemainingTimeOracle counting = () -> {
            calls[0]++;
            return Duration.ofSeconds(1);
        };

        DeadlineBudget.compute(Optional.of(counting), BUFFER_10MS);

        assertEquals(1, calls[0]);
    }

    @Test
    void unhostedRejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new DeadlineBudget.Unhosted(Duration.ZERO));
    }

    private static Optional<RemainingTimeOracle> oracle(Duration remaining) {
        return Optional.of(() -> remaining);
    }
}
