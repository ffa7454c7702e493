package com.dexarb.infra.rpc;

import com.dexarb.support.FakeTicker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final FakeTicker ticker = new FakeTicker();
    private final RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(500), Duration.ofMillis(5000),
            Duration.ZERO, ticker, new Random(1));

    @Test
    void backsOffExponentiallyUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        String result = policy.execute((e, attempt) -> RetryPolicy.RetryMode.BACKOFF, attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new RpcException(RpcErrorKind.RATE_LIMITED, "429");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(TimeUnit.MILLISECONDS.toNanos(500), TimeUnit.MILLISECONDS.toNanos(1000)), ticker.sleeps());
    }

    @Test
    void immediateRetryDoesNotSleep() {
        AtomicInteger calls = new AtomicInteger();
        int attempts = policy.execute((e, attempt) -> RetryPolicy.RetryMode.IMMEDIATE, attempt -> {
            if (calls.incrementAndGet() < 2) {
                throw new RpcException(RpcErrorKind.NETWORK, "reset");
            }
            return attempt;
        });
        assertEquals(2, attempts);
        assertTrue(ticker.sleeps().isEmpty());
    }

    @Test
    void nonRetryableFailureIsThrownAfterOneAttempt() {
        AtomicInteger calls = new AtomicInteger();
        RpcException thrown = assertThrows(RpcException.class,
                () -> policy.execute((e, attempt) -> RetryPolicy.RetryMode.NONE, attempt -> {
                    calls.incrementAndGet();
                    throw new RpcException(RpcErrorKind.INSUFFICIENT_LIQUIDITY, "no liquidity");
                }));
        assertEquals(RpcErrorKind.INSUFFICIENT_LIQUIDITY, thrown.getKind());
        assertEquals(1, calls.get());
    }

    @Test
    void lastFailureSurfacesWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();
        RpcException thrown = assertThrows(RpcException.class,
                () -> policy.execute((e, attempt) -> RetryPolicy.RetryMode.BACKOFF, attempt -> {
                    throw new RpcException(RpcErrorKind.RATE_LIMITED, "attempt " + calls.incrementAndGet());
                }));
        assertEquals(4, calls.get());
        assertEquals("attempt 4", thrown.getMessage());
    }

    @Test
    void delayIsCappedAtMaximum() {
        assertEquals(5000, policy.delayMillis(10));
    }

    @Test
    void interruptionCancelsAndKeepsTheFlag() {
        try {
            assertThrows(CancellationException.class,
                    () -> policy.execute((e, attempt) -> RetryPolicy.RetryMode.BACKOFF, attempt -> {
                        throw new InterruptedException();
                    }));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
