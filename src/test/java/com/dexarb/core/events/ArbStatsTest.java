package com.dexarb.core.events;

import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.ExecutionState;
import com.dexarb.domain.ExecutionStatus;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.GuardVerdict;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ArbStatsTest {

    private static final GuardVerdict VERDICT = new GuardVerdict(true, new BigDecimal("1.25"), new BigDecimal("2"),
            new BigDecimal("0.75"), new BigDecimal("20"), new BigDecimal("22"), null);

    @Test
    void onlyConfirmedTradesAddProfit() {
        ArbStats stats = new ArbStats();

        stats.record(outcome(ExecutionStatus.SUCCESS), VERDICT);
        stats.record(outcome(ExecutionStatus.UNCONFIRMED), VERDICT);
        stats.record(ExecutionOutcome.failed(ExecutionState.SUBMIT, FailureReason.EXECUTION_REVERTED, "x"), VERDICT);
        stats.record(outcome(ExecutionStatus.SKIPPED), VERDICT);
        stats.tick();
        stats.tick();

        ArbStats.Snapshot snapshot = stats.snapshot();
        assertEquals(2, snapshot.ticks());
        assertEquals(4, snapshot.attempts());
        assertEquals(1, snapshot.successes());
        assertEquals(1, snapshot.failures());
        assertEquals(1, snapshot.unconfirmed());
        assertEquals(1, snapshot.skipped());
        assertEquals(0, new BigDecimal("1.25").compareTo(snapshot.estimatedProfitUsd()));
    }

    private static ExecutionOutcome outcome(ExecutionStatus status) {
        return ExecutionOutcome.builder().status(status).build();
    }
}
