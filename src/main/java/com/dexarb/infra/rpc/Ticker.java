package com.dexarb.infra.rpc;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic time plus sleeping, so throttling and backoff can run against a fake clock in tests.
 */
public interface Ticker {

    long nanoTime();

    void sleepNanos(long nanos) throws InterruptedException;

    static Ticker system() {
        return new Ticker() {
            @Override
            public long nanoTime() {
                return System.nanoTime();
            }

            @Override
            public void sleepNanos(long nanos) throws InterruptedException {
                if (nanos > 0) {
                    TimeUnit.NANOSECONDS.sleep(nanos);
                }
            }
        };
    }
}
