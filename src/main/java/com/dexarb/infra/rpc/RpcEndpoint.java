package com.dexarb.infra.rpc;

import lombok.Getter;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * One JSON-RPC URL with its own throughput budget and concurrency ceiling.
 */
public class RpcEndpoint {

    @Getter
    private final String url;
    @Getter
    private final int maxConcurrent;
    private final TokenBucket bucket;
    private final Semaphore gate;
    private final AtomicInteger inFlight = new AtomicInteger();

    public RpcEndpoint(String url, int requestsPerSecond, int maxConcurrent, Ticker ticker) {
        this.url = url;
        this.maxConcurrent = maxConcurrent;
        this.bucket = new TokenBucket(requestsPerSecond, ticker);
        this.gate = new Semaphore(maxConcurrent, true);
    }

    /**
     * Runs {@code call} once a concurrency slot and a token are both held.
     */
    public <T> T execute(Supplier<T> call) throws InterruptedException {
        gate.acquire();
        try {
            bucket.acquire();
            inFlight.incrementAndGet();
            try {
                return call.get();
            } finally {
                inFlight.decrementAndGet();
            }
        } finally {
            gate.release();
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int availableTokens() {
        return bucket.availableTokens();
    }

    @Override
    public String toString() {
        return url;
    }
}
