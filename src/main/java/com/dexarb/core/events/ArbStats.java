package com.dexarb.core.events;

import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.GuardVerdict;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session counters. Estimated profit only accumulates for confirmed trades.
 */
@Component
public class ArbStats {

    public record Snapshot(long ticks, long attempts, long successes, long failures, long unconfirmed, long skipped,
            BigDecimal estimatedProfitUsd) {
    }

    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong unconfirmed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicReference<BigDecimal> profit = new AtomicReference<>(BigDecimal.ZERO);

    public long tick() {
        return ticks.incrementAndGet();
    }

    public void record(ExecutionOutcome outcome, GuardVerdict verdict) {
        attempts.incrementAndGet();
        switch (outcome.getStatus()) {
            case SUCCESS -> {
                successes.incrementAndGet();
                if (verdict.netUsd() != null) {
                    profit.accumulateAndGet(verdict.netUsd(), BigDecimal::add);
                }
            }
            case FAILED -> failures.incrementAndGet();
            case UNCONFIRMED -> unconfirmed.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(ticks.get(), attempts.get(), successes.get(), failures.get(), unconfirmed.get(),
                skipped.get(), profit.get());
    }
}
