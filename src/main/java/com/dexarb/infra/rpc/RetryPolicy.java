package com.dexarb.infra.rpc;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Bounded retry with exponential backoff and jitter. Call sites only decide, per failure, whether and how
 * to retry; attempt bookkeeping and sleeping live here.
 */
@Slf4j
public class RetryPolicy {

    public enum RetryMode {
        NONE,
        IMMEDIATE,
        BACKOFF
    }

    @FunctionalInterface
    public interface RetryClassifier {
        RetryMode classify(RuntimeException error, int attempt);
    }

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call(int attempt) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final long jitterMillis;
    private final Ticker ticker;
    private final Random random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration jitter,
            Ticker ticker, Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelay.toMillis();
        this.maxDelayMillis = maxDelay.toMillis();
        this.jitterMillis = jitter.toMillis();
        this.ticker = ticker;
        this.random = random;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code call} until it succeeds, the classifier answers NONE, or attempts run out. The last
     * failure is rethrown unchanged.
     */
    public <T> T execute(RetryClassifier classifier, RetryableCall<T> call) {
        int attempt = 1;
        int backoffs = 0;
        while (true) {
            try {
                return call.call(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted on attempt " + attempt);
            } catch (RuntimeException e) {
                RetryMode mode = classifier.classify(e, attempt);
                if (mode == RetryMode.NONE || attempt >= maxAttempts) {
                    throw e;
                }
                if (mode == RetryMode.BACKOFF) {
                    long delay = delayMillis(backoffs++);
                    log.debug("Attempt {}/{} failed ({}), backing off {} ms", attempt, maxAttempts, e.getMessage(), delay);
                    sleep(delay);
                } else {
                    log.debug("Attempt {}/{} failed ({}), retrying now", attempt, maxAttempts, e.getMessage());
                }
                attempt++;
            }
        }
    }

    long delayMillis(int backoffIndex) {
        long exp = baseDelayMillis << Math.min(backoffIndex, 20);
        long jitter = jitterMillis > 0 ? (long) (random.nextDouble() * jitterMillis) : 0;
        return Math.min(exp + jitter, maxDelayMillis);
    }

    private void sleep(long millis) {
        try {
            ticker.sleepNanos(TimeUnit.MILLISECONDS.toNanos(millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during backoff");
        }
    }
}
