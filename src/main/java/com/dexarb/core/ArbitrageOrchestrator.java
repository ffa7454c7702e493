package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.cache.NegativeCache;
import com.dexarb.core.events.ArbStats;
import com.dexarb.core.events.TradeEventPublisher;
import com.dexarb.core.events.TradeEventTypes;
import com.dexarb.core.execution.ExecutionEngine;
import com.dexarb.core.execution.PendingReconciler;
import com.dexarb.core.pricing.ProfitabilityGuard;
import com.dexarb.core.pricing.TradeSizer;
import com.dexarb.core.quote.FanOutResult;
import com.dexarb.core.quote.QuoteFanOut;
import com.dexarb.core.resolver.TokenMetadataResolver;
import com.dexarb.domain.ArbitrageOpportunity;
import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.ExecutionStatus;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.GuardVerdict;
import com.dexarb.domain.Quote;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.Token;
import com.dexarb.domain.TradePair;
import com.dexarb.domain.TradeRecord;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Driver loop: one configured pair per tick, round-robin. Each tick reconciles any pending swap for the
 * sell token, then sizes, quotes, guards and executes. A tick that overruns its budget is cancelled, and
 * repeated failing ticks make the driver sit out a growing number of ticks.
 */
@Slf4j
@Service
public class ArbitrageOrchestrator {

    enum TickResult {
        IDLE,
        TRADED,
        FAILED
    }

    private final ArbProperties.Driver config;
    private final TokenMetadataResolver tokens;
    private final TradeSizer sizer;
    private final QuoteFanOut fanOut;
    private final ProfitabilityGuard guard;
    private final ExecutionEngine engine;
    private final PendingReconciler reconciler;
    private final TradeEventPublisher publisher;
    private final ArbStats stats;
    private final NegativeCache cache;
    private final ExecutorService tickExecutor;
    private final Clock clock;
    private final List<TradePair> pairs;

    private int cursor;
    private int consecutiveFailures;
    private int ticksToSkip;

    public ArbitrageOrchestrator(ArbProperties properties, TokenMetadataResolver tokens, TradeSizer sizer,
            QuoteFanOut fanOut, ProfitabilityGuard guard, ExecutionEngine engine,
            PendingReconciler reconciler, TradeEventPublisher publisher, ArbStats stats, NegativeCache cache,
            @Qualifier("tickExecutor") ExecutorService tickExecutor, Clock clock) {
        this.config = properties.driver();
        this.tokens = tokens;
        this.sizer = sizer;
        this.fanOut = fanOut;
        this.guard = guard;
        this.engine = engine;
        this.reconciler = reconciler;
        this.publisher = publisher;
        this.stats = stats;
        this.cache = cache;
        this.tickExecutor = tickExecutor;
        this.clock = clock;
        this.pairs = activePairs(config.pairs(), config.exclude());
        log.info("Driver pairs: {} (excluded: {})", pairs, config.exclude());
    }

    static List<TradePair> activePairs(List<String> labels, List<String> excludeLabels) {
        List<TradePair> excluded = excludeLabels.stream().map(TradePair::parse).toList();
        return labels.stream()
                .map(TradePair::parse)
                .filter(p -> excluded.stream().noneMatch(p::matchesEitherWay))
                .toList();
    }

    @Scheduled(fixedDelayString = "${arb.driver.interval-millis:2000}",
            initialDelayString = "${arb.driver.interval-millis:2000}")
    public void runLoop() {
        if (!Boolean.TRUE.equals(config.enabled()) || pairs.isEmpty()) {
            return;
        }
        if (ticksToSkip > 0) {
            ticksToSkip--;
            log.info("[DRIVER] backing off after {} failed ticks ({} more to skip)", consecutiveFailures, ticksToSkip);
            return;
        }
        TradePair pair = pairs.get(Math.floorMod(cursor++, pairs.size()));
        TickResult result = runWithBudget(pair);
        afterTick(result);
    }

    TickResult runWithBudget(TradePair pair) {
        Future<TickResult> future = tickExecutor.submit(() -> runPair(pair));
        try {
            return future.get(config.tickBudgetMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[DRIVER] {} abandoned after {} ms tick budget", pair, config.tickBudgetMillis());
            return TickResult.FAILED;
        } catch (ExecutionException e) {
            log.error("[DRIVER] {} tick failed", pair, e.getCause());
            return TickResult.FAILED;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TickResult.FAILED;
        }
    }

    TickResult runPair(TradePair pair) {
        try {
            Token sell = tokens.resolveLabel(pair.sell());
            Token buy = tokens.resolveLabel(pair.buy());

            if (!reconcilePending(sell)) {
                return TickResult.IDLE;
            }

            BigInteger amount = sizer.size(sell, config.tradeUsd());
            log.debug("[SIZE] {} {} USD -> {} {}", pair, config.tradeUsd(), amount, sell.symbol());

            FanOutResult quotes = fanOut.quoteAll(sell, buy, amount);
            Optional<Quote> best = quotes.best();
            if (best.isEmpty()) {
                log.info("[QUOTE] {} {}: no router answered {}", pair, FailureReason.NO_QUOTE, quotes.failures());
                return TickResult.IDLE;
            }

            GuardVerdict verdict = guard.evaluate(best.get());
            if (!verdict.ok()) {
                return TickResult.IDLE;
            }

            ArbitrageOpportunity opp = ArbitrageOpportunity.builder()
                    .id(UUID.randomUUID().toString())
                    .pair(pair)
                    .quote(best.get())
                    .verdict(verdict)
                    .detectedAt(clock.instant())
                    .build();
            ExecutionOutcome outcome = engine.execute(opp);
            stats.record(outcome, verdict);
            publisher.publish(TradeEventTypes.TRADE_RECORD, pair.label(), TradeRecord.of(opp, outcome, clock.instant()));
            return outcome.getStatus() == ExecutionStatus.FAILED ? TickResult.FAILED : TickResult.TRADED;
        } catch (QuoteException e) {
            log.warn("[DRIVER] {} skipped: {} ({})", pair, e.getReason(), e.getMessage());
            return TickResult.IDLE;
        } catch (RpcException e) {
            log.warn("[DRIVER] {} failed: {} ({})", pair, FailureReason.fromRpc(e.getKind()), e.getMessage());
            return TickResult.FAILED;
        } catch (CancellationException e) {
            log.warn("[DRIVER] {} cancelled: {}", pair, e.getMessage());
            return TickResult.FAILED;
        }
    }

    /**
     * @return true when no swap for {@code sell} is still in flight
     */
    boolean reconcilePending(Token sell) {
        PendingReconciler.Resolution resolution = reconciler.reconcile(sell.address());
        if (resolution.blocking()) {
            log.info("[PENDING] {} swap {} still unconfirmed, skipping {}", FailureReason.PENDING_TRANSACTION,
                    resolution.entry().txHash(), resolution.entry().pair());
            return false;
        }
        if (resolution.status() == PendingReconciler.Status.MINED) {
            publisher.publish(TradeEventTypes.TRADE_RECONCILED, resolution.entry().pair(), resolution.receipt());
        }
        return true;
    }

    private void afterTick(TickResult result) {
        long tick = stats.tick();
        if (result == TickResult.FAILED) {
            consecutiveFailures++;
            if (consecutiveFailures >= config.backoffAfterErrors()) {
                ticksToSkip = Math.min(consecutiveFailures - config.backoffAfterErrors() + 1, config.maxSkippedTicks());
            }
        } else {
            consecutiveFailures = 0;
        }
        if (tick % config.statsEveryTicks() == 0) {
            ArbStats.Snapshot snapshot = stats.snapshot();
            log.info("[STATS] {}", snapshot);
            publisher.publish(TradeEventTypes.SESSION_STATS, snapshot);
            cache.sweep();
        }
    }

    int ticksToSkip() {
        return ticksToSkip;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }
}
