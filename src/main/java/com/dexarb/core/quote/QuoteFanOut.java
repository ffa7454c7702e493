package com.dexarb.core.quote;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Quote;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.Token;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Asks every enabled router for a quote in parallel and waits for all of them. A failing router only
 * removes itself from the ranking.
 */
@Slf4j
@Service
public class QuoteFanOut {

    private final RouterRegistry registry;
    private final Executor executor;

    public QuoteFanOut(RouterRegistry registry, @Qualifier("fanOutExecutor") Executor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    public FanOutResult quoteAll(Token sell, Token buy, BigInteger amountIn) {
        List<RouterAdapter> adapters = registry.enabled();
        Map<String, CompletableFuture<Quote>> futures = new LinkedHashMap<>();
        for (RouterAdapter adapter : adapters) {
            futures.put(adapter.id(), CompletableFuture.supplyAsync(() -> adapter.quote(sell, buy, amountIn), executor));
        }

        List<Quote> quotes = new ArrayList<>();
        Map<String, FailureReason> failures = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<Quote>> entry : futures.entrySet()) {
            String routerId = entry.getKey();
            try {
                quotes.add(entry.getValue().get());
            } catch (InterruptedException e) {
                futures.values().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Quote fan-out interrupted");
            } catch (ExecutionException e) {
                FailureReason reason = reasonOf(e.getCause());
                failures.put(routerId, reason);
                if (e.getCause() instanceof QuoteException || e.getCause() instanceof RpcException) {
                    log.info("[QUOTE] {} gave no quote for {}->{}: {} ({})", routerId, sell.symbol(), buy.symbol(),
                            reason, e.getCause().getMessage());
                } else {
                    log.error("[QUOTE] {} failed unexpectedly for {}->{}", routerId, sell.symbol(), buy.symbol(),
                            e.getCause());
                }
            }
        }

        quotes.sort(Comparator.comparing(Quote::getBuyAmount).reversed());
        if (!quotes.isEmpty()) {
            Quote best = quotes.get(0);
            log.info("[QUOTE] best {} {} {} -> {} {} ({} of {} routers answered)", best.getRouterId(),
                    amountIn, sell.symbol(), best.getBuyAmount(), buy.symbol(), quotes.size(), adapters.size());
        }
        return new FanOutResult(List.copyOf(quotes), failures);
    }

    static FailureReason reasonOf(Throwable error) {
        if (error instanceof QuoteException q) {
            return q.getReason();
        }
        if (error instanceof RpcException r) {
            return FailureReason.fromRpc(r.getKind());
        }
        return FailureReason.RPC_ERROR;
    }
}
