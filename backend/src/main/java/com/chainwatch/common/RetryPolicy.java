package com.chainwatch.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay schedule for retries: fixed delay (watcher reconnects) or exponential backoff with jitter (RPC calls).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final boolean exponential;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, true);
    }

    private RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, boolean exponential) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.exponential = exponential;
    }

    /**
     * Same delay before every attempt, no jitter.
     */
    public static RetryPolicy fixed(long delayMs, int maxAttempts) {
        return new RetryPolicy(delayMs, 0, maxAttempts, false);
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Exponential: baseDelay * 2^attempt, then ± jitter. Fixed: baseDelay.
     */
    public long delayMs(int attempt) {
        if (!exponential || attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long value = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(value);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isExponential() {
        return exponential;
    }

    /**
     * Default for RPC calls: 500ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
