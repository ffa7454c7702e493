package com.dexarb.infra.rpc;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket refilled to full capacity once per window. Callers that find it empty sleep until the
 * next window boundary instead of spinning.
 */
public class TokenBucket {

    private final int capacity;
    private final long windowNanos;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock(true);

    private int tokens;
    private long windowStart;

    public TokenBucket(int permitsPerSecond, Ticker ticker) {
        this(permitsPerSecond, TimeUnit.SECONDS.toNanos(1), ticker);
    }

    public TokenBucket(int capacity, long windowNanos, Ticker ticker) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.windowNanos = windowNanos;
        this.ticker = ticker;
        this.tokens = capacity;
        this.windowStart = ticker.nanoTime();
    }

    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                long now = ticker.nanoTime();
                refill(now);
                if (tokens > 0) {
                    tokens--;
                    return;
                }
                waitNanos = windowStart + windowNanos - now;
            } finally {
                lock.unlock();
            }
            ticker.sleepNanos(Math.max(waitNanos, 1));
        }
    }

    public int availableTokens() {
        lock.lock();
        try {
            refill(ticker.nanoTime());
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void refill(long now) {
        long elapsed = now - windowStart;
        if (elapsed >= windowNanos) {
            tokens = capacity;
            // stay aligned to window boundaries so a late caller cannot stretch a window
            windowStart += (elapsed / windowNanos) * windowNanos;
        }
    }
}
